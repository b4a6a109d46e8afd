package io.github.eutro.ncs2nss.api.events;

/**
 * An event whose remaining listeners are skipped once a listener cancels it.
 * The stage that fired it still completes.
 */
public interface CancellableEvent {
    boolean isCancelled();

    /**
     * Skip the listeners after this one.
     */
    void cancel();
}
