package io.github.eutro.ncs2nss.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which analysis results can be attached to an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which gives {@link ExtHolder} a stable iteration order.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.getAndIncrement();
    private final Class<?> type;
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class is only used for debugging, so a raw class may be given for a generic value type.
     *
     * @param type The erased type of the value.
     * @param name A human-readable name.
     * @param <T>  The erased type.
     * @param <R>  The full type of the value.
     * @return The ext.
     */
    @SuppressWarnings("unused")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
