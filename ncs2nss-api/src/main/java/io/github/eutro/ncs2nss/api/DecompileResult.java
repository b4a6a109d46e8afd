package io.github.eutro.ncs2nss.api;

import io.github.eutro.ncs2nss.api.verify.Verification;
import io.github.eutro.ncs2nss.core.Diagnostic;
import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.repair.RepairConfig;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a {@link Decompilation}: the source, and everything found while producing it.
 */
public final class DecompileResult {
    /**
     * The repaired source.
     */
    @NotNull
    public final String source;
    /**
     * The source as printed, before repair.
     */
    @NotNull
    public final String rawSource;
    @NotNull
    public final GameVariant variant;
    public final List<Diagnostic> diagnostics;
    /**
     * The repair configuration this result was repaired with, holding the record of applied repairs.
     */
    @NotNull
    public final RepairConfig repairConfig;
    @Nullable
    private Verification verification;

    public DecompileResult(@NotNull String source,
                           @NotNull String rawSource,
                           @NotNull GameVariant variant,
                           List<Diagnostic> diagnostics,
                           @NotNull RepairConfig repairConfig) {
        this.source = source;
        this.rawSource = rawSource;
        this.variant = variant;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.repairConfig = repairConfig;
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind == kind) return true;
        }
        return false;
    }

    /**
     * Get the outcome of round-trip verification, if any was run.
     *
     * @return The verification, or null.
     */
    @Nullable
    public Verification getVerification() {
        return verification;
    }

    public void setVerification(@Nullable Verification verification) {
        this.verification = verification;
    }
}
