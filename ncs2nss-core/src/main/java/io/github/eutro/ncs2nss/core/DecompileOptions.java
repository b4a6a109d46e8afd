package io.github.eutro.ncs2nss.core;

import io.github.eutro.ncs2nss.core.repair.RepairConfig;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The configuration of a decompilation, passed explicitly into the pipeline.
 */
public final class DecompileOptions {
    /**
     * The defaults: switches preferred, tolerant signatures, {@link RepairConfig#createDefault() default repairs}.
     */
    public static final DecompileOptions DEFAULT = builder().build();

    /**
     * Emit switch statements for dispatch chains that qualify, rather than if/else chains.
     */
    public final boolean preferSwitches;
    /**
     * Report engine calls whose argument count disagrees with the signature table.
     */
    public final boolean strictSignatures;
    private final RepairConfig repairTemplate;

    private DecompileOptions(Builder builder) {
        this.preferSwitches = builder.preferSwitches;
        this.strictSignatures = builder.strictSignatures;
        this.repairTemplate = builder.repairConfig.copy();
    }

    /**
     * Get a fresh repair configuration for one decompilation, with an empty accumulator.
     *
     * @return The configuration.
     */
    @NotNull
    public RepairConfig newRepairConfig() {
        return repairTemplate.copy();
    }

    @Contract(pure = true)
    public static Builder builder() {
        return new Builder();
    }

    @Contract(pure = true)
    public Builder toBuilder() {
        return new Builder()
                .preferSwitches(preferSwitches)
                .strictSignatures(strictSignatures)
                .repairConfig(repairTemplate);
    }

    public static final class Builder {
        private boolean preferSwitches = true;
        private boolean strictSignatures = false;
        private RepairConfig repairConfig = RepairConfig.createDefault();

        private Builder() {
        }

        public Builder preferSwitches(boolean preferSwitches) {
            this.preferSwitches = preferSwitches;
            return this;
        }

        public Builder strictSignatures(boolean strictSignatures) {
            this.strictSignatures = strictSignatures;
            return this;
        }

        /**
         * Set the repair configuration. It is copied, both here and for each decompilation.
         *
         * @param repairConfig The configuration.
         * @return This builder.
         */
        public Builder repairConfig(@NotNull RepairConfig repairConfig) {
            this.repairConfig = repairConfig.copy();
            return this;
        }

        public DecompileOptions build() {
            return new DecompileOptions(this);
        }
    }
}
