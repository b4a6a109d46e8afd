package io.github.eutro.ncs2nss.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The statements recovered from one basic block, and the condition it branches on, if any.
 */
public final class BlockCode {
    /**
     * The graph-wide index of the block.
     */
    public final int block;
    public final int offset;
    public final List<Region> statements = new ArrayList<>();
    @Nullable
    private Expr condition;
    private boolean returns;
    private final Map<Region, Integer> insertionOrder = new IdentityHashMap<>();

    public BlockCode(int block, int offset) {
        this.block = block;
        this.offset = offset;
    }

    /**
     * Get the condition under which the block takes its {@link io.github.eutro.ncs2nss.core.cfg.EdgeKind#BRANCH_TRUE} edge.
     *
     * @return The condition, or null if the block does not branch.
     */
    @Nullable
    public Expr getCondition() {
        return condition;
    }

    public void setCondition(@Nullable Expr condition) {
        this.condition = condition;
    }

    /**
     * Whether the block ends in a subroutine return.
     *
     * @return Whether the block returns.
     */
    public boolean returns() {
        return returns;
    }

    public void setReturns(boolean returns) {
        this.returns = returns;
    }

    /**
     * Whether the block only returns: the shared exit that {@code return} statements jump to.
     *
     * @return Whether this is an epilogue.
     */
    public boolean isEpilogue() {
        return returns && statements.isEmpty();
    }

    /**
     * Whether the statements end in a {@link Region.Return}.
     *
     * @return Whether the block ends in a return statement.
     */
    public boolean endsInReturn() {
        return !statements.isEmpty() && statements.get(statements.size() - 1) instanceof Region.Return;
    }

    @Nullable
    public Region lastStatement() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    /**
     * Insert a statement for a value computed earlier, after the statement that was last when it was computed.
     * Statements inserted after the same anchor stay in the order their values were computed.
     *
     * @param anchor   The statement the value was computed after, or null if it was computed before all of them.
     * @param sequence The order the value was computed in.
     * @param stmt     The statement.
     */
    public void insertAfter(@Nullable Region anchor, int sequence, Region stmt) {
        int i = 0;
        if (anchor != null) {
            i = indexOf(anchor);
            if (i == -1) {
                statements.add(stmt);
                insertionOrder.put(stmt, sequence);
                return;
            }
            i++;
        }
        while (i < statements.size()) {
            Integer other = insertionOrder.get(statements.get(i));
            if (other == null || other > sequence) break;
            i++;
        }
        statements.add(i, stmt);
        insertionOrder.put(stmt, sequence);
    }

    private int indexOf(Region stmt) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == stmt) return i;
        }
        return -1;
    }
}
