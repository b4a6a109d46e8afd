package io.github.eutro.ncs2nss.core.passes;

/**
 * An {@link #isInPlace() in-place} pass, run for its effect on its input.
 *
 * @param <T> The type this pass runs on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass.
     *
     * @param t The input, which is annotated or modified.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    /**
     * {@inheritDoc}
     *
     * @return {@code true}
     */
    @Override
    default boolean isInPlace() {
        return true;
    }
}
