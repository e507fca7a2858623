package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.config.PatternSettings;
import com.ipcsentinel.core.model.EventTypes;
import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Flags repeated rejected calls on privileged channels.
 *
 * <p>
 * Counts {@code unauthorized_sender} events among the last {@code lookback}
 * whose channel starts with one of the privileged prefixes
 * ({@code admin:}, {@code system:}, {@code internal:} by default) and matches
 * when the count exceeds {@code minAttempts}.
 * </p>
 */
public class PrivilegeEscalationPattern implements AttackPattern {

    public static final String NAME = "privilege_escalation_attempt";

    private final int lookback;
    private final int minAttempts;
    private final List<String> privilegedPrefixes;

    public PrivilegeEscalationPattern(PatternSettings.PrivilegeEscalation settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.lookback = settings.getLookback();
        this.minAttempts = settings.getMinAttempts();
        this.privilegedPrefixes = List.copyOf(settings.getPrivilegedPrefixes());
    }

    @Override
    public boolean detect(EventHistory history) {
        long attempts = history.last(lookback).stream()
                .filter(event -> EventTypes.UNAUTHORIZED_SENDER.equals(event.getType()))
                .filter(this::targetsPrivilegedChannel)
                .count();
        return attempts > minAttempts;
    }

    private boolean targetsPrivilegedChannel(SecurityEvent event) {
        return event.getChannel()
                .map(channel -> privilegedPrefixes.stream().anyMatch(channel::startsWith))
                .orElse(false);
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
