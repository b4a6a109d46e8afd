package io.github.eutro.ncs2nss.core.repair;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Which textual repairs to run on emitted source, and the record of those applied.
 * <p>
 * A configuration is mutable and accumulates, so each decompilation should get its own {@link #copy()}.
 */
public final class RepairConfig {
    public static final int DEFAULT_MAX_REPAIR_PASSES = 3;

    private boolean syntaxRepair = true;
    private boolean typeRepair = true;
    private boolean expressionRepair = true;
    private boolean controlFlowRepair = true;
    private boolean functionSignatureRepair = true;
    private int maxRepairPasses = DEFAULT_MAX_REPAIR_PASSES;
    private boolean verboseLogging = false;

    private boolean repairsApplied = false;
    private final List<String> appliedRepairs = new ArrayList<>();

    /**
     * All repairs, without the verbose record.
     *
     * @return A new configuration.
     */
    @Contract(pure = true)
    public static RepairConfig createDefault() {
        return new RepairConfig();
    }

    /**
     * Only the syntax repair.
     *
     * @return A new configuration.
     */
    @Contract(pure = true)
    public static RepairConfig createMinimal() {
        RepairConfig config = new RepairConfig();
        config.setTypeRepair(false);
        config.setExpressionRepair(false);
        config.setControlFlowRepair(false);
        config.setFunctionSignatureRepair(false);
        return config;
    }

    /**
     * All repairs, recording each one applied.
     *
     * @return A new configuration.
     */
    @Contract(pure = true)
    public static RepairConfig createComprehensive() {
        RepairConfig config = new RepairConfig();
        config.setVerboseLogging(true);
        return config;
    }

    /**
     * Copy the settings of this configuration, with an empty record.
     *
     * @return The copy.
     */
    @Contract(pure = true)
    @NotNull
    public RepairConfig copy() {
        RepairConfig config = new RepairConfig();
        config.syntaxRepair = syntaxRepair;
        config.typeRepair = typeRepair;
        config.expressionRepair = expressionRepair;
        config.controlFlowRepair = controlFlowRepair;
        config.functionSignatureRepair = functionSignatureRepair;
        config.maxRepairPasses = maxRepairPasses;
        config.verboseLogging = verboseLogging;
        return config;
    }

    public boolean isSyntaxRepair() {
        return syntaxRepair;
    }

    public void setSyntaxRepair(boolean syntaxRepair) {
        this.syntaxRepair = syntaxRepair;
    }

    public boolean isTypeRepair() {
        return typeRepair;
    }

    public void setTypeRepair(boolean typeRepair) {
        this.typeRepair = typeRepair;
    }

    public boolean isExpressionRepair() {
        return expressionRepair;
    }

    public void setExpressionRepair(boolean expressionRepair) {
        this.expressionRepair = expressionRepair;
    }

    public boolean isControlFlowRepair() {
        return controlFlowRepair;
    }

    public void setControlFlowRepair(boolean controlFlowRepair) {
        this.controlFlowRepair = controlFlowRepair;
    }

    public boolean isFunctionSignatureRepair() {
        return functionSignatureRepair;
    }

    public void setFunctionSignatureRepair(boolean functionSignatureRepair) {
        this.functionSignatureRepair = functionSignatureRepair;
    }

    public int getMaxRepairPasses() {
        return maxRepairPasses;
    }

    public void setMaxRepairPasses(int maxRepairPasses) {
        if (maxRepairPasses < 0) {
            throw new IllegalArgumentException("maxRepairPasses must not be negative, got " + maxRepairPasses);
        }
        this.maxRepairPasses = maxRepairPasses;
    }

    public boolean isVerboseLogging() {
        return verboseLogging;
    }

    public void setVerboseLogging(boolean verboseLogging) {
        this.verboseLogging = verboseLogging;
    }

    /**
     * Whether the last repair changed the text.
     *
     * @return Whether any repair was applied.
     */
    public boolean isRepairsApplied() {
        return repairsApplied;
    }

    void setRepairsApplied(boolean repairsApplied) {
        this.repairsApplied = repairsApplied;
    }

    /**
     * Get the descriptions of the repairs applied so far. Only filled with {@link #isVerboseLogging() verbose logging}.
     *
     * @return The live list.
     */
    public List<String> getAppliedRepairs() {
        return appliedRepairs;
    }
}
