package io.github.eutro.ncs2nss.core.repair;

import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.Diagnostics;
import org.jetbrains.annotations.NotNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Where {@link RepairRule}s record what they did.
 */
public final class RepairLog {
    private static final Logger LOGGER = System.getLogger(RepairLog.class.getName());

    @NotNull
    private final RepairConfig config;
    @NotNull
    private final Diagnostics diagnostics;
    private int applied;

    public RepairLog(@NotNull RepairConfig config, @NotNull Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * Record a repair that changed the text.
     *
     * @param description What was changed.
     */
    public void applied(String description) {
        applied++;
        diagnostics.report(DiagnosticKind.REPAIR_APPLIED, description);
        if (config.isVerboseLogging()) {
            config.getAppliedRepairs().add(description);
        }
    }

    /**
     * Record a problem found while repairing, which may or may not have been fixed.
     *
     * @param kind    The kind of problem.
     * @param message The description.
     */
    public void report(DiagnosticKind kind, String message) {
        diagnostics.report(kind, message);
    }

    /**
     * Note something that needs a human to look at, without changing the text.
     *
     * @param message The description.
     */
    public void warn(String message) {
        LOGGER.log(Level.WARNING, message);
        if (config.isVerboseLogging()) {
            config.getAppliedRepairs().add("Warning: " + message);
        }
    }

    public int getApplied() {
        return applied;
    }

    @NotNull
    public RepairConfig getConfig() {
        return config;
    }
}
