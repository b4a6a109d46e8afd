package io.github.eutro.ncs2nss.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something decompiler events can be listened for on, either a {@link io.github.eutro.ncs2nss.api.NcsDecompiler}
 * or a single {@link io.github.eutro.ncs2nss.api.Decompilation}.
 *
 * @param <S> The events accepted.
 */
public interface EventDispatcher<S> {
    /**
     * Register a listener for one event class.
     * <p>
     * Matching is by exact class; listeners for a supertype of the fired event are not run.
     *
     * @param eventClass The class of event to listen for.
     * @param listener   The listener, which may modify the event's public fields.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
