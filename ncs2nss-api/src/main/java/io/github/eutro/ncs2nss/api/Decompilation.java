package io.github.eutro.ncs2nss.api;

import io.github.eutro.ncs2nss.api.events.*;
import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import io.github.eutro.ncs2nss.core.ncs.NcsReader;
import io.github.eutro.ncs2nss.core.passes.convert.BuildCfg;
import io.github.eutro.ncs2nss.core.passes.convert.CfgToScript;
import io.github.eutro.ncs2nss.core.passes.convert.EmitSource;
import io.github.eutro.ncs2nss.core.repair.OutputRepairProcessor;
import io.github.eutro.ncs2nss.core.repair.RepairConfig;
import org.jetbrains.annotations.NotNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;

/**
 * Represents the decompilation of a single compiled script.
 * <p>
 * Decompilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunDecompilationEvent} is fired on the {@link NcsDecompiler decompiler}.</li>
 *     <li>The bytecode is {@link NcsReader decoded}.</li>
 *     <li>{@link DecodedEvent} is fired.</li>
 *     <li>The {@link BuildCfg control-flow graph is built}.</li>
 *     <li>{@link CfgBuiltEvent} is fired.</li>
 *     <li>Subroutines, expressions and statements are {@link CfgToScript recovered}.</li>
 *     <li>{@link ScriptRecoveredEvent} is fired.</li>
 *     <li>The script is {@link EmitSource printed}.</li>
 *     <li>{@link SourceEmittedEvent} is fired.</li>
 *     <li>The source is {@link OutputRepairProcessor repaired}.</li>
 *     <li>{@link OutputEvent} is fired.</li>
 * </ol>
 * Malformed bytecode and unresolvable jumps abort the run with a
 * {@link io.github.eutro.ncs2nss.core.DecompilationException}; no event after the failing stage is fired.
 */
public class Decompilation extends EventSupplier<DecompilationEvent> {
    private static final Logger LOGGER = System.getLogger(Decompilation.class.getName());

    private final NcsDecompiler dc;

    /**
     * The bytecode being decompiled.
     */
    @NotNull
    public ByteBuffer bytes;
    /**
     * The game the script was compiled for.
     */
    @NotNull
    public GameVariant variant;
    @NotNull
    private final DecompileOptions options;

    Decompilation(NcsDecompiler dc, @NotNull ByteBuffer bytes, @NotNull GameVariant variant, @NotNull DecompileOptions options) {
        this.dc = dc;
        this.bytes = bytes;
        this.variant = variant;
        this.options = options;
    }

    @NotNull
    public DecompileOptions getOptions() {
        return options;
    }

    /**
     * Run the decompilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The result, as left by the {@link OutputEvent} listeners.
     */
    public DecompileResult run() {
        dc.dispatch(RunDecompilationEvent.class, new RunDecompilationEvent(this));

        InstructionStream code = NcsReader.read(bytes, variant);
        code = dispatch(DecodedEvent.class, new DecodedEvent(code)).code;

        ControlFlowGraph graph = BuildCfg.INSTANCE.run(code);
        graph = dispatch(CfgBuiltEvent.class, new CfgBuiltEvent(graph)).graph;

        Script script = new CfgToScript(SignatureTable.forVariant(code.getVariant()), options).run(graph);
        script = dispatch(ScriptRecoveredEvent.class, new ScriptRecoveredEvent(script)).script;

        String raw = EmitSource.INSTANCE.run(script);
        raw = dispatch(SourceEmittedEvent.class, new SourceEmittedEvent(raw)).source;

        Diagnostics diagnostics = script.diagnostics;
        RepairConfig repairConfig = options.newRepairConfig();
        String source = new OutputRepairProcessor(repairConfig, diagnostics).run(raw);
        LOGGER.log(Level.DEBUG, "Decompiled {0} script with {1} diagnostics",
                code.getVariant(), diagnostics.list().size());

        DecompileResult result = new DecompileResult(source, raw, code.getVariant(), diagnostics.list(), repairConfig);
        return dispatch(OutputEvent.class, new OutputEvent(result)).result;
    }
}
