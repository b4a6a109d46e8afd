package io.github.eutro.ncs2nss.core.ext;

import io.github.eutro.ncs2nss.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something analyses can attach their results to, keyed by {@link Ext}.
 */
public interface ExtContainer {
    /**
     * Attach a value, replacing any previous one.
     *
     * @param ext   The key.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value for the ext, if there is one.
     *
     * @param ext The key.
     * @param <T> The value type.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the attached value, or null.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The value, or null if nothing is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the attached value, failing if the analysis that produces it was not run.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The value.
     * @throws IllegalStateException If nothing is attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException("Ext " + ext.getName() + " not present");
        }
        return value;
    }

    /**
     * Get the attached value, running the pass that computes it first if it is missing.
     *
     * @param ext  The key.
     * @param o    The object to run the pass on.
     * @param pass The pass that attaches the ext.
     * @param <T>  The value type.
     * @param <O>  The type the pass runs on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
