package io.github.eutro.ncs2nss.core.cfg;

import io.github.eutro.ncs2nss.core.ext.ExtHolder;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * The basic blocks of a script, in instruction order. Block {@code i} has index {@code i}.
 * <p>
 * Analyses attach their results as exts, leaving the blocks themselves untouched.
 */
public final class ControlFlowGraph extends ExtHolder {
    @NotNull
    private final InstructionStream code;
    private final List<BasicBlock> blocks;
    private final int[] blockOfInsn;

    ControlFlowGraph(@NotNull InstructionStream code, List<BasicBlock> blocks) {
        this.code = code;
        this.blocks = Collections.unmodifiableList(blocks);
        blockOfInsn = new int[code.size()];
        for (BasicBlock block : blocks) {
            for (int i = block.getFirst(); i <= block.getLast(); i++) {
                blockOfInsn[i] = block.getIndex();
            }
        }
    }

    @NotNull
    public InstructionStream getCode() {
        return code;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock get(int index) {
        return blocks.get(index);
    }

    public int size() {
        return blocks.size();
    }

    /**
     * Find the block containing an instruction.
     *
     * @param insnIndex The instruction index.
     * @return The block index.
     */
    public int blockOf(int insnIndex) {
        return blockOfInsn[insnIndex];
    }

    /**
     * Get the byte offset a block starts at.
     *
     * @param block The block index.
     * @return The offset.
     */
    public int offsetOf(int block) {
        return code.get(blocks.get(block).getFirst()).getOffset();
    }

    /**
     * Create a graph. Blocks must be given in order, with indices matching their positions.
     *
     * @param code   The instructions.
     * @param blocks The blocks.
     * @return The graph.
     */
    public static ControlFlowGraph of(InstructionStream code, List<BasicBlock> blocks) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).getIndex() != i) {
                throw new IllegalArgumentException("Block " + blocks.get(i) + " out of place at " + i);
            }
        }
        return new ControlFlowGraph(code, blocks);
    }

    /**
     * Create a block, for graph construction.
     *
     * @param index   The block's index.
     * @param first   The first instruction.
     * @param last    The last instruction, inclusive.
     * @param edges   The outgoing edges.
     * @param callee  The called block, or -1.
     * @param closure The closure entry block, or -1.
     * @return The block.
     */
    public static BasicBlock block(int index, int first, int last, List<Edge> edges, int callee, int closure) {
        return new BasicBlock(index, first, last, edges, callee, closure);
    }
}
