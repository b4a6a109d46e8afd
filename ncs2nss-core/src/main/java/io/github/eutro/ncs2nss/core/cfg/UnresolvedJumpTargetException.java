package io.github.eutro.ncs2nss.core.cfg;

import io.github.eutro.ncs2nss.core.DecompilationException;

/**
 * Thrown when a jump lands somewhere other than the start of an instruction.
 */
public class UnresolvedJumpTargetException extends DecompilationException {
    private final int target;

    public UnresolvedJumpTargetException(int source, int target) {
        super(String.format("Jump target 0x%04x is not an instruction boundary", target), source);
        this.target = target;
    }

    /**
     * Get the offset the jump pointed to.
     *
     * @return The offset.
     */
    public int getTarget() {
        return target;
    }
}
