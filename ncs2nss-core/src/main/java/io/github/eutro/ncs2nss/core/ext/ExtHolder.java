package io.github.eutro.ncs2nss.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An {@link ExtContainer} backed by a lazily allocated sorted map.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> exts = null;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) exts = new TreeMap<>();
        exts.put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts == null) return;
        exts.remove(ext);
        if (exts.isEmpty()) exts = null;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }
}
