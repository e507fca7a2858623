package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.config.PatternSettings;
import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Flags machine-regular traffic.
 *
 * <p>
 * Takes the last {@code lookback} events, computes the intervals between
 * consecutive timestamps and matches when their population variance is below
 * {@code maxVariance} (ms²). Humans are not that regular; scripts are.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Stays silent until the log holds {@code minEvents} events.
 * </p>
 */
public class AutomatedAttackPattern implements AttackPattern {

    public static final String NAME = "automated_attack";

    private final int minEvents;
    private final int lookback;
    private final double maxVariance;

    public AutomatedAttackPattern(PatternSettings.AutomatedAttack settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.minEvents = settings.getMinEvents();
        this.lookback = settings.getLookback();
        this.maxVariance = settings.getMaxVariance();
    }

    @Override
    public boolean detect(EventHistory history) {
        if (history.totalEvents() < minEvents) {
            return false;
        }
        List<SecurityEvent> recent = history.last(lookback);
        if (recent.size() < 2) {
            return false;
        }
        return intervalVariance(recent) < maxVariance;
    }

    static double intervalVariance(List<SecurityEvent> events) {
        int n = events.size() - 1;
        long[] intervals = new long[n];
        double sum = 0;
        for (int i = 1; i < events.size(); i++) {
            intervals[i - 1] = events.get(i).getTimestampMillis() - events.get(i - 1).getTimestampMillis();
            sum += intervals[i - 1];
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (long interval : intervals) {
            double diff = interval - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / n;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Severity getSeverity() {
        return Severity.HIGH;
    }

    @Override
    public int getLookback() {
        return lookback;
    }
}
