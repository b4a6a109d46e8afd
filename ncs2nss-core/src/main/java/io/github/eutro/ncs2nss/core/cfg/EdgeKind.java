package io.github.eutro.ncs2nss.core.cfg;

public enum EdgeKind {
    /**
     * Control falls into the next block.
     */
    FALLTHROUGH,
    /**
     * An unconditional jump.
     */
    JUMP,
    /**
     * Taken when the branch condition is non-zero.
     */
    BRANCH_TRUE,
    /**
     * Taken when the branch condition is zero.
     */
    BRANCH_FALSE,
    /**
     * From a subroutine call to its return site.
     */
    CALL,
    /**
     * From a subroutine return to {@link BasicBlock#EXIT}.
     */
    RETURN,
}
