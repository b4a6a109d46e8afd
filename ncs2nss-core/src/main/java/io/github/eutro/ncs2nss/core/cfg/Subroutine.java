package io.github.eutro.ncs2nss.core.cfg;

import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.ExtHolder;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * The blocks reachable from one subroutine entry, without following calls.
 * <p>
 * Per-subroutine analyses work on dense <i>local</i> indices: local index 0 is the entry,
 * the rest follow in instruction order.
 */
public final class Subroutine extends ExtHolder {
    public enum Kind {
        /**
         * The code at offset zero that calls the globals initializer or the main function.
         */
        ENTRY_STUB,
        /**
         * Initializes globals, then saves the base pointer and calls the main function.
         */
        GLOBALS,
        FUNCTION,
        /**
         * The deferred action saved by {@code STORE_STATE}.
         */
        CLOSURE,
    }

    @NotNull
    private final ControlFlowGraph graph;
    @NotNull
    private Kind kind;
    private final int[] blocks;
    private final Map<Integer, Integer> localIndex = new HashMap<>();
    private final int[] forced;
    private int[][] successors;

    public Subroutine(@NotNull ControlFlowGraph graph, @NotNull Kind kind, int entry, Collection<Integer> members) {
        this.graph = graph;
        this.kind = kind;
        TreeSet<Integer> sorted = new TreeSet<>(members);
        sorted.remove(entry);
        blocks = new int[sorted.size() + 1];
        blocks[0] = entry;
        int i = 1;
        for (int b : sorted) blocks[i++] = b;
        for (int j = 0; j < blocks.length; j++) localIndex.put(blocks[j], j);
        forced = new int[blocks.length];
        Arrays.fill(forced, -1);
    }

    @NotNull
    public ControlFlowGraph getGraph() {
        return graph;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    public void setKind(@NotNull Kind kind) {
        this.kind = kind;
    }

    public int getEntry() {
        return blocks[0];
    }

    public int size() {
        return blocks.length;
    }

    /**
     * Get the graph-wide index of a block.
     *
     * @param local The local index.
     * @return The block index.
     */
    public int block(int local) {
        return blocks[local];
    }

    public BasicBlock basicBlock(int local) {
        return graph.get(blocks[local]);
    }

    /**
     * Get the local index of a block.
     *
     * @param block The graph-wide block index.
     * @return The local index, or -1 if the block is not part of this subroutine.
     */
    public int local(int block) {
        Integer l = localIndex.get(block);
        return l == null ? -1 : l;
    }

    public boolean contains(int block) {
        return localIndex.containsKey(block);
    }

    /**
     * Make a conditional block behave as if it always continued to one of its successors.
     * Used where a branch only implements an operator, such as a short-circuiting {@code &&}.
     *
     * @param local  The block.
     * @param target The successor to keep.
     */
    public void forceSuccessor(int local, int target) {
        forced[local] = target;
        successors = null;
        MetadataState ms = getNullable(CommonExts.METADATA_STATE);
        if (ms != null) ms.graphChanged();
    }

    /**
     * Get the successor a block was forced to.
     *
     * @param local The block.
     * @return The successor, or -1 if the block was not forced.
     */
    public int forcedSuccessor(int local) {
        return forced[local];
    }

    /**
     * Get the intra-procedural successors by local index, in edge order. Returns and edges
     * leaving the subroutine are omitted, and {@link #forceSuccessor(int, int) forced} blocks
     * have only their forced successor.
     *
     * @return The successor arrays. Must not be modified.
     */
    public int[][] successors() {
        if (successors == null) {
            successors = new int[blocks.length][];
            for (int i = 0; i < blocks.length; i++) {
                if (forced[i] != -1) {
                    successors[i] = new int[]{forced[i]};
                    continue;
                }
                List<Edge> edges = graph.get(blocks[i]).getEdges();
                int[] ss = new int[edges.size()];
                int n = 0;
                for (Edge edge : edges) {
                    int l = edge.target == BasicBlock.EXIT ? -1 : local(edge.target);
                    if (l != -1) ss[n++] = l;
                }
                successors[i] = Arrays.copyOf(ss, n);
            }
        }
        return successors;
    }

    /**
     * Get the offset of the subroutine's first instruction.
     *
     * @return The offset.
     */
    public int getOffset() {
        return graph.offsetOf(blocks[0]);
    }

    @Override
    public String toString() {
        return kind + "@" + String.format("%04x", getOffset());
    }
}
