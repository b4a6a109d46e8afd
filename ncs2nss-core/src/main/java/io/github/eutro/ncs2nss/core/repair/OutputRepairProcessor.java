package io.github.eutro.ncs2nss.core.repair;

import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.passes.IRPass;
import org.jetbrains.annotations.NotNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs the enabled {@link RepairRule}s over emitted source, pass after pass, until a pass changes nothing
 * or {@link RepairConfig#getMaxRepairPasses()} passes have run.
 */
public class OutputRepairProcessor implements IRPass<String, String> {
    private static final Logger LOGGER = System.getLogger(OutputRepairProcessor.class.getName());

    /**
     * The rules, in the order each pass applies them.
     */
    public static final List<RepairRule> RULES = Collections.unmodifiableList(Arrays.asList(
            SyntaxRepair.INSTANCE,
            TypeRepair.INSTANCE,
            ExpressionRepair.INSTANCE,
            ControlFlowRepair.INSTANCE,
            FunctionSignatureRepair.INSTANCE
    ));

    @NotNull
    private final RepairConfig config;
    @NotNull
    private final Diagnostics diagnostics;

    public OutputRepairProcessor(@NotNull RepairConfig config, @NotNull Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * Repair some source, discarding the diagnostics.
     *
     * @param text   The source.
     * @param config The configuration, which receives the record of applied repairs.
     * @return The repaired source.
     */
    public static String repair(@NotNull String text, @NotNull RepairConfig config) {
        return new OutputRepairProcessor(config, new Diagnostics()).run(text);
    }

    @Override
    public String run(String text) {
        boolean changed = false;
        if (!text.isEmpty()) {
            List<String> lines = SourceText.split(text);
            RepairLog log = new RepairLog(config, diagnostics);
            for (int pass = 0; pass < config.getMaxRepairPasses(); pass++) {
                for (RepairRule rule : RULES) {
                    if (rule.isEnabled(config)) rule.apply(lines, log);
                }
                String next = SourceText.join(lines);
                if (next.equals(text)) break;
                changed = true;
                text = next;
                LOGGER.log(Level.DEBUG, "Repair pass {0} changed the source, {1} repairs so far", pass + 1, log.getApplied());
                if (config.isVerboseLogging()) {
                    config.getAppliedRepairs().add("Pass " + (pass + 1) + ": Applied repairs");
                }
            }
        }
        config.setRepairsApplied(changed);
        return text;
    }
}
