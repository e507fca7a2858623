package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.config.PatternSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates the built-in {@link AttackPattern}s from {@link PatternSettings}.
 *
 * <p>
 * New heuristics are added here; the monitor evaluates whatever list it is
 * given.
 * </p>
 *
 * @since 1.0.0
 */
public final class AttackPatternFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AttackPatternFactory.class);

    private AttackPatternFactory() {
        // utility class — not instantiable
    }

    /**
     * @return the four built-in patterns with default parameters
     */
    public static List<AttackPattern> createDefaults() {
        return createAll(new PatternSettings());
    }

    /**
     * Create every built-in pattern with the given parameters.
     *
     * @param settings pattern parameters; must not be {@code null}
     * @return unmodifiable list of patterns
     */
    public static List<AttackPattern> createAll(PatternSettings settings) {
        Objects.requireNonNull(settings, "PatternSettings must not be null");
        List<AttackPattern> patterns = List.of(
                new RapidChannelSwitchingPattern(settings.getRapidChannelSwitching()),
                new PrivilegeEscalationPattern(settings.getPrivilegeEscalation()),
                new DdosAttackPattern(settings.getDdos()),
                new AutomatedAttackPattern(settings.getAutomatedAttack()));
        LOG.info("Created {} attack pattern(s)", patterns.size());
        return patterns;
    }
}
