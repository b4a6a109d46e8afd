package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.Decompilation;
import io.github.eutro.ncs2nss.api.NcsDecompiler;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a decompilation is started.
 *
 * @see NcsDecompiler
 * @see Decompilation
 */
public class RunDecompilationEvent implements DecompilerEvent {
    /**
     * The decompilation.
     */
    @NotNull
    public Decompilation decompilation;

    public RunDecompilationEvent(@NotNull Decompilation decompilation) {
        this.decompilation = decompilation;
    }
}
