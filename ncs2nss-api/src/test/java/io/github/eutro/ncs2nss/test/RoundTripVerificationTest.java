package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.api.DecompileResult;
import io.github.eutro.ncs2nss.api.NcsDecompiler;
import io.github.eutro.ncs2nss.api.bits.RoundTripVerification;
import io.github.eutro.ncs2nss.api.verify.ConfirmationDialog;
import io.github.eutro.ncs2nss.api.verify.RoundTripVerifier;
import io.github.eutro.ncs2nss.api.verify.Verification;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RoundTripVerificationTest {
    private static final byte[] HELLO = NcsAssembler.printing("hello");

    static class CountingVerifier implements RoundTripVerifier {
        final boolean confirm;
        final Verification outcome;
        int calls;
        String lastSource;
        GameVariant lastVariant;

        CountingVerifier(boolean confirm, Verification outcome) {
            this.confirm = confirm;
            this.outcome = outcome;
        }

        @Override
        public Verification verify(String source, GameVariant variant) {
            calls++;
            lastSource = source;
            lastVariant = variant;
            return outcome;
        }

        @Override
        public boolean requiresConfirmation() {
            return confirm;
        }
    }

    /**
     * Answers every question the same way, ticking "don't show again" if asked to.
     */
    static class ScriptedDialog implements ConfirmationDialog {
        final boolean answer;
        final boolean dontShowAgain;
        final Set<String> suppressed = new HashSet<>();
        int asked;

        ScriptedDialog(boolean answer, boolean dontShowAgain) {
            this.answer = answer;
            this.dontShowAgain = dontShowAgain;
        }

        @Override
        public boolean confirm(String title, String message) {
            asked++;
            if (dontShowAgain) suppress(RoundTripVerification.CONFIRMATION_KEY);
            return answer;
        }

        @Override
        public boolean isSuppressed(String key) {
            return suppressed.contains(key);
        }

        @Override
        public void suppress(String key) {
            suppressed.add(key);
        }
    }

    private static DecompileResult run(RoundTripVerifier verifier, ConfirmationDialog dialog) {
        NcsDecompiler dc = new NcsDecompiler();
        dc.add(new RoundTripVerification(verifier, dialog));
        return dc.submit(HELLO, GameVariant.K2).run();
    }

    @Test
    void testNoVerificationByDefault() {
        assertNull(new NcsDecompiler().submit(HELLO, GameVariant.K1).run().getVerification());
    }

    @Test
    void testConfirmed() {
        CountingVerifier verifier = new CountingVerifier(true, Verification.passed());
        ScriptedDialog dialog = new ScriptedDialog(true, false);
        DecompileResult result = run(verifier, dialog);
        assertEquals(1, dialog.asked);
        assertEquals(1, verifier.calls);
        assertEquals(result.source, verifier.lastSource);
        assertEquals(GameVariant.K2, verifier.lastVariant);
        assertNotNull(result.getVerification());
        assertTrue(result.getVerification().isSuccess());
    }

    @Test
    void testDeclined() {
        CountingVerifier verifier = new CountingVerifier(true, Verification.passed());
        ScriptedDialog dialog = new ScriptedDialog(false, false);
        DecompileResult result = run(verifier, dialog);
        assertEquals(1, dialog.asked);
        assertEquals(0, verifier.calls);
        assertNotNull(result.getVerification());
        assertEquals(Verification.Status.DECLINED, result.getVerification().status);
    }

    @Test
    void testDontShowAgain() {
        CountingVerifier verifier = new CountingVerifier(true, Verification.passed());
        ScriptedDialog dialog = new ScriptedDialog(true, true);
        NcsDecompiler dc = new NcsDecompiler();
        dc.add(new RoundTripVerification(verifier, dialog));
        dc.submit(HELLO, GameVariant.K1).run();
        dc.submit(HELLO, GameVariant.K1).run();
        DecompileResult last = dc.submit(HELLO, GameVariant.K1).run();
        assertEquals(1, dialog.asked);
        assertEquals(3, verifier.calls);
        assertTrue(last.getVerification().isSuccess());
    }

    @Test
    void testAlreadySuppressed() {
        CountingVerifier verifier = new CountingVerifier(true, Verification.passed());
        ScriptedDialog dialog = new ScriptedDialog(false, false);
        dialog.suppress(RoundTripVerification.CONFIRMATION_KEY);
        DecompileResult result = run(verifier, dialog);
        assertEquals(0, dialog.asked);
        assertEquals(1, verifier.calls);
        assertTrue(result.getVerification().isSuccess());
    }

    @Test
    void testNoConfirmationNeeded() {
        CountingVerifier verifier = new CountingVerifier(false, Verification.passed());
        ScriptedDialog dialog = new ScriptedDialog(false, false);
        run(verifier, dialog);
        assertEquals(0, dialog.asked);
        assertEquals(1, verifier.calls);
    }

    @Test
    void testFailureRecorded() {
        CountingVerifier verifier = new CountingVerifier(false, Verification.failed("line 3: syntax error"));
        DecompileResult result = run(verifier, new ScriptedDialog(true, false));
        Verification verification = result.getVerification();
        assertNotNull(verification);
        assertEquals(Verification.Status.FAILED, verification.status);
        assertFalse(verification.isSuccess());
        assertEquals("FAILED: line 3: syntax error", verification.toString());
    }
}
