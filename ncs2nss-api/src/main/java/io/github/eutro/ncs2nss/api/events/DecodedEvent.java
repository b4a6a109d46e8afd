package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.Decompilation;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the bytecode has been decoded.
 *
 * @see Decompilation
 */
public class DecodedEvent implements DecompilationEvent {
    /**
     * The decoded instructions. Replacing these changes what the rest of the decompilation sees.
     */
    @NotNull
    public InstructionStream code;

    public DecodedEvent(@NotNull InstructionStream code) {
        this.code = code;
    }
}
