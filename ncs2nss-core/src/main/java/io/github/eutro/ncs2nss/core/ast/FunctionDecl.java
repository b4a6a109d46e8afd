package io.github.eutro.ncs2nss.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * A recovered subroutine, ready for emission.
 */
public final class FunctionDecl {
    @NotNull
    public final SubroutineSignature signature;
    @NotNull
    public final Region body;
    /**
     * The offset of the subroutine's first instruction.
     */
    public final int offset;

    public FunctionDecl(@NotNull SubroutineSignature signature, @NotNull Region body, int offset) {
        this.signature = signature;
        this.body = body;
        this.offset = offset;
    }
}
