package io.github.eutro.ncs2nss.api.verify;

import io.github.eutro.ncs2nss.core.ncs.GameVariant;

/**
 * Checks decompiled source by recompiling it, typically with an external compiler.
 * The decompiler never runs one itself; see {@link io.github.eutro.ncs2nss.api.bits.RoundTripVerification}.
 */
public interface RoundTripVerifier {
    /**
     * Recompile some source.
     *
     * @param source  The source.
     * @param variant The game to compile for.
     * @return Whether it compiled, with any compiler output.
     */
    Verification verify(String source, GameVariant variant);

    /**
     * Whether the user should be asked before this verifier runs, for example because it needs elevated access.
     *
     * @return Whether to ask.
     */
    boolean requiresConfirmation();
}
