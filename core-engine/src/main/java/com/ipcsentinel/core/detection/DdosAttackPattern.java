package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.config.PatternSettings;
import com.ipcsentinel.core.model.EventTypes;
import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Flags a flood of rate-limit rejections.
 *
 * <p>
 * Matches when more than {@code minRateLimitEvents} of the last
 * {@code lookback} events are {@code rate_limit_exceeded} and the oldest of
 * those {@code lookback} events is less than {@code maxSpanMs} old.
 * </p>
 */
public class DdosAttackPattern implements AttackPattern {

    public static final String NAME = "ddos_attack";

    private final int lookback;
    private final int minRateLimitEvents;
    private final long maxSpanMs;

    public DdosAttackPattern(PatternSettings.Ddos settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.lookback = settings.getLookback();
        this.minRateLimitEvents = settings.getMinRateLimitEvents();
        this.maxSpanMs = settings.getMaxSpanMs();
    }

    @Override
    public boolean detect(EventHistory history) {
        List<SecurityEvent> recent = history.last(lookback);
        if (recent.isEmpty()) {
            return false;
        }
        long rateLimited = recent.stream()
                .filter(event -> EventTypes.RATE_LIMIT_EXCEEDED.equals(event.getType()))
                .count();
        long age = history.now() - recent.get(0).getTimestampMillis();
        return rateLimited > minRateLimitEvents && age < maxSpanMs;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Severity getSeverity() {
        return Severity.CRITICAL;
    }

    @Override
    public int getLookback() {
        return lookback;
    }
}
