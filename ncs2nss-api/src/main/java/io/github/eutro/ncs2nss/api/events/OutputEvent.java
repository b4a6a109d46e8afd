package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.DecompileResult;
import io.github.eutro.ncs2nss.api.Decompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired last, with the finished result.
 *
 * @see Decompilation
 */
public class OutputEvent implements DecompilationEvent, CancellableEvent {
    /**
     * The result, which {@link Decompilation#run()} returns.
     */
    @NotNull
    public DecompileResult result;
    private boolean cancelled = false;

    public OutputEvent(@NotNull DecompileResult result) {
        this.result = result;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
