package io.github.eutro.ncs2nss.core;

/**
 * A fatal error that aborts the decompilation of a script.
 * <p>
 * No partial output accompanies one of these.
 */
public class DecompilationException extends RuntimeException {
    private final int offset;

    public DecompilationException(String message, int offset) {
        super(String.format("%s (at offset 0x%04x)", message, offset));
        this.offset = offset;
    }

    /**
     * Get the byte offset in the script where decompilation could not proceed.
     *
     * @return The offset.
     */
    public int getOffset() {
        return offset;
    }
}
