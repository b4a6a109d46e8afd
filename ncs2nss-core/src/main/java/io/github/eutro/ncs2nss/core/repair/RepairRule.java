package io.github.eutro.ncs2nss.core.repair;

import java.util.List;

/**
 * A rewrite over the lines of emitted source.
 * <p>
 * Rules must be total and settle in one application: running a rule on its own output changes nothing.
 */
public interface RepairRule {
    /**
     * Whether this rule is switched on.
     *
     * @param config The configuration.
     * @return Whether to run it.
     */
    boolean isEnabled(RepairConfig config);

    /**
     * Rewrite the lines in place.
     *
     * @param lines The lines, without terminators.
     * @param log   Where to record each change.
     */
    void apply(List<String> lines, RepairLog log);
}
