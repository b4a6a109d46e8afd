package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.Decompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired with the printed source, before it is repaired.
 *
 * @see Decompilation
 */
public class SourceEmittedEvent implements DecompilationEvent {
    /**
     * The unrepaired source.
     */
    @NotNull
    public String source;

    public SourceEmittedEvent(@NotNull String source) {
        this.source = source;
    }
}
