package io.github.eutro.ncs2nss.core.cfg;

import io.github.eutro.ncs2nss.core.ncs.Instruction;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;

import java.util.Collections;
import java.util.List;

/**
 * A maximal run of instructions with a single entry and a single exit. Immutable once the graph is built.
 * <p>
 * Blocks borrow their instructions from the stream by index range, and refer to other blocks by index.
 */
public final class BasicBlock {
    /**
     * The target of {@link EdgeKind#RETURN} edges.
     */
    public static final int EXIT = -1;

    private final int index;
    private final int first;
    private final int last;
    private final List<Edge> edges;
    private final int callee;
    private final int closure;

    BasicBlock(int index, int first, int last, List<Edge> edges, int callee, int closure) {
        this.index = index;
        this.first = first;
        this.last = last;
        this.edges = Collections.unmodifiableList(edges);
        this.callee = callee;
        this.closure = closure;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Get the index of the first instruction of the block.
     *
     * @return The index.
     */
    public int getFirst() {
        return first;
    }

    /**
     * Get the index of the last instruction of the block, inclusive.
     *
     * @return The index.
     */
    public int getLast() {
        return last;
    }

    public int size() {
        return last - first + 1;
    }

    /**
     * Get the outgoing edges. Conditional branches list the fallthrough side first.
     *
     * @return The edges.
     */
    public List<Edge> getEdges() {
        return edges;
    }

    /**
     * Get the block a {@code JSR} ending this block calls.
     *
     * @return The entry block of the callee, or -1 if this block does not end in a call.
     */
    public int getCallee() {
        return callee;
    }

    /**
     * Get the entry of the deferred action whose state a {@code STORE_STATE} in this block saves.
     *
     * @return The closure entry block, or -1.
     */
    public int getClosure() {
        return closure;
    }

    public Instruction terminator(InstructionStream code) {
        return code.get(last);
    }

    public boolean isConditional() {
        return edges.size() == 2;
    }

    /**
     * Get the target of the edge of the given kind.
     *
     * @param kind The edge kind.
     * @return The target, or {@link #EXIT} if there is no such edge.
     */
    public int target(EdgeKind kind) {
        for (Edge edge : edges) {
            if (edge.kind == kind) return edge.target;
        }
        return EXIT;
    }

    @Override
    public String toString() {
        return "b" + index + "[" + first + ".." + last + "] " + edges;
    }
}
