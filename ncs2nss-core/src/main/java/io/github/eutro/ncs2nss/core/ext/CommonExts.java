package io.github.eutro.ncs2nss.core.ext;

import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.ast.BlockCode;
import io.github.eutro.ncs2nss.core.ast.LocalSlot;
import io.github.eutro.ncs2nss.core.ast.Region;
import io.github.eutro.ncs2nss.core.ast.SubroutineSignature;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import io.github.eutro.ncs2nss.core.cfg.Loop;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.passes.convert.BuildCfg;
import io.github.eutro.ncs2nss.core.passes.convert.RecoverExpressions;
import io.github.eutro.ncs2nss.core.passes.convert.StructureRegions;
import io.github.eutro.ncs2nss.core.passes.meta.*;

import java.util.List;
import java.util.Map;

/**
 * The {@link Ext}s the decompiler's passes communicate through.
 */
public class CommonExts {
    /**
     * Attached to a {@link Subroutine}. Which of its analyses are up to date.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link ControlFlowGraph} by {@link BuildCfg}. Collects the non-fatal problems of the decompilation.
     */
    public static final Ext<Diagnostics> DIAGNOSTICS = Ext.create(Diagnostics.class, "DIAGNOSTICS");

    /**
     * Attached to a {@link ControlFlowGraph}. The subroutines, in entry order.
     * <p>
     * Computed by {@link FindSubroutines}.
     */
    public static final Ext<List<Subroutine>> SUBROUTINES = Ext.create(List.class, "SUBROUTINES");
    /**
     * Attached to a {@link ControlFlowGraph}. The subroutines by entry block.
     * <p>
     * Computed by {@link FindSubroutines}.
     */
    public static final Ext<Map<Integer, Subroutine>> SUBROUTINE_BY_ENTRY = Ext.create(Map.class, "SUBROUTINE_BY_ENTRY");
    /**
     * Attached to a {@link ControlFlowGraph}. The script's entry function.
     * <p>
     * Computed by {@link FindSubroutines}.
     */
    public static final Ext<Subroutine> MAIN_SUBROUTINE = Ext.create(Subroutine.class, "MAIN_SUBROUTINE");
    /**
     * Attached to a {@link ControlFlowGraph}, if the script has globals. The subroutine initializing them.
     * <p>
     * Computed by {@link FindSubroutines}.
     */
    public static final Ext<Subroutine> GLOBALS_SUBROUTINE = Ext.create(Subroutine.class, "GLOBALS_SUBROUTINE");
    /**
     * Attached to a {@link ControlFlowGraph}. The global variables, bottom of the stack first.
     * <p>
     * Computed by {@link RecoverExpressions}.
     */
    public static final Ext<List<LocalSlot>> GLOBALS = Ext.create(List.class, "GLOBALS");

    /**
     * Attached to a {@link ControlFlowGraph}. The statements declaring and initializing the globals.
     * <p>
     * Computed by {@link RecoverExpressions}.
     */
    public static final Ext<List<Region>> GLOBAL_STATEMENTS = Ext.create(List.class, "GLOBAL_STATEMENTS");

    /**
     * Attached to a {@link Subroutine}. The predecessors of each block, by local index.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<int[][]> PREDS = Ext.create(int[][].class, "PREDS");
    /**
     * Attached to a {@link Subroutine}. The immediate dominator of each block, or -1.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<int[]> IDOM = Ext.create(int[].class, "IDOM");
    /**
     * Attached to a {@link Subroutine}. The immediate post-dominator of each block in the
     * graph the structurer sees, or -1 where that is the exit.
     * <p>
     * Computed by {@link ComputePostDoms}.
     */
    public static final Ext<int[]> IPDOM = Ext.create(int[].class, "IPDOM");
    /**
     * Attached to a {@link Subroutine}. The natural loops, by header.
     * <p>
     * Computed by {@link FindLoops}.
     */
    public static final Ext<Map<Integer, Loop>> LOOPS = Ext.create(Map.class, "LOOPS");
    /**
     * Attached to a {@link Subroutine}. For blocks joining the two sides of a short-circuit
     * operator, the predecessor whose stack carries the operator's result.
     * <p>
     * Computed by {@link FindShortCircuits}.
     */
    public static final Ext<Map<Integer, Integer>> SHORT_CIRCUIT_JOINS = Ext.create(Map.class, "SHORT_CIRCUIT_JOINS");

    /**
     * Attached to a {@link Subroutine}. Its parameters and return value.
     * <p>
     * Computed by {@link InferSubroutineSignatures}.
     */
    public static final Ext<SubroutineSignature> SIGNATURE = Ext.create(SubroutineSignature.class, "SIGNATURE");
    /**
     * Attached to a {@link Subroutine}. The statements and branch condition recovered for each block, by local index.
     * <p>
     * Computed by {@link RecoverExpressions}.
     */
    public static final Ext<BlockCode[]> BLOCK_CODE = Ext.create(BlockCode[].class, "BLOCK_CODE");
    /**
     * Attached to a {@link Subroutine}. The structured body.
     * <p>
     * Computed by {@link StructureRegions}.
     */
    public static final Ext<Region> BODY = Ext.create(Region.class, "BODY");
    /**
     * Attached to a {@link Subroutine}. The region each block was placed in, by graph-wide block index.
     * <p>
     * Computed by {@link StructureRegions}.
     */
    public static final Ext<Map<Integer, Region>> REGION_OWNERS = Ext.create(Map.class, "REGION_OWNERS");
}
