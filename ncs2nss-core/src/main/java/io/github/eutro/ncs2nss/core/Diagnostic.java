package io.github.eutro.ncs2nss.core;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A single non-fatal finding.
 */
public final class Diagnostic {
    /**
     * Used as the offset of diagnostics not tied to a bytecode location.
     */
    public static final int NO_OFFSET = -1;

    @NotNull
    public final DiagnosticKind kind;
    /**
     * The byte offset in the script the finding relates to, or {@link #NO_OFFSET}.
     */
    public final int offset;
    @NotNull
    public final String message;

    public Diagnostic(@NotNull DiagnosticKind kind, int offset, @NotNull String message) {
        this.kind = kind;
        this.offset = offset;
        this.message = message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return offset == that.offset && kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, offset, message);
    }

    @Override
    public String toString() {
        return offset == NO_OFFSET
                ? kind + ": " + message
                : String.format("%s at 0x%04x: %s", kind, offset, message);
    }
}
