package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.NcsDecompiler;

/**
 * An event fired on the {@link NcsDecompiler} itself.
 */
public interface DecompilerEvent {
}
