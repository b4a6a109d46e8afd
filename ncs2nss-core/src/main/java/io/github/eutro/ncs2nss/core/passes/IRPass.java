package io.github.eutro.ncs2nss.core.passes;

import io.github.eutro.ncs2nss.core.passes.misc.ChainedPass;

/**
 * A stage of the decompiler, which either transforms its input into another form
 * (e.g. instructions into a graph), or analyses it and attaches the results.
 * <p>
 * A pass that returns its own input, having only annotated or modified it,
 * is <i>in-place</i> and should say so through {@link #isInPlace()}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The result.
     */
    B run(A a);

    /**
     * Get whether this pass returns its input.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which receives this pass's result.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
