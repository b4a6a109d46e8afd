package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.Decompilation;

/**
 * An event fired during the decompilation of a single script.
 *
 * @see Decompilation
 */
public interface DecompilationEvent {
}
