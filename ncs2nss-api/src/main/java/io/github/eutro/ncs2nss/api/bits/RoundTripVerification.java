package io.github.eutro.ncs2nss.api.bits;

import io.github.eutro.ncs2nss.api.DecompileResult;
import io.github.eutro.ncs2nss.api.NcsDecompiler;
import io.github.eutro.ncs2nss.api.events.OutputEvent;
import io.github.eutro.ncs2nss.api.verify.ConfirmationDialog;
import io.github.eutro.ncs2nss.api.verify.RoundTripVerifier;
import io.github.eutro.ncs2nss.api.verify.Verification;
import org.jetbrains.annotations.NotNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * A bit which recompiles every result with a {@link RoundTripVerifier}, recording the outcome on the result.
 * <p>
 * If the verifier {@link RoundTripVerifier#requiresConfirmation() requires confirmation}, the user is asked first,
 * unless the dialog has {@link #CONFIRMATION_KEY} suppressed, in which case the verifier runs without asking.
 */
public class RoundTripVerification implements Bit<NcsDecompiler, Void> {
    private static final Logger LOGGER = System.getLogger(RoundTripVerification.class.getName());

    /**
     * The key of the confirmation question in the {@link ConfirmationDialog}.
     */
    public static final String CONFIRMATION_KEY = "ncs2nss.roundTripVerification";
    public static final String TITLE = "Round-trip verification";
    public static final String MESSAGE = "The decompiled script will be recompiled with an external compiler "
            + "to check it. This may need elevated access. Continue?";

    @NotNull
    private final RoundTripVerifier verifier;
    @NotNull
    private final ConfirmationDialog dialog;

    public RoundTripVerification(@NotNull RoundTripVerifier verifier, @NotNull ConfirmationDialog dialog) {
        this.verifier = verifier;
        this.dialog = dialog;
    }

    @Override
    public Void addTo(NcsDecompiler dc) {
        dc.lift().listen(OutputEvent.class, evt -> verify(evt.result));
        return null;
    }

    private void verify(DecompileResult result) {
        if (verifier.requiresConfirmation() && !dialog.isSuppressed(CONFIRMATION_KEY)) {
            if (!dialog.confirm(TITLE, MESSAGE)) {
                LOGGER.log(Level.DEBUG, "Round-trip verification declined");
                result.setVerification(Verification.declined());
                return;
            }
        }
        Verification verification = verifier.verify(result.source, result.variant);
        if (!verification.isSuccess()) {
            LOGGER.log(Level.WARNING, "Round-trip verification failed: {0}", verification);
        }
        result.setVerification(verification);
    }
}
