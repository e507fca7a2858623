package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.config.PatternSettings;
import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.model.Severity;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Flags a caller probing many channels in a short burst.
 *
 * <p>
 * Matches when the log holds at least {@code minEvents} events and the last
 * {@code lookback} of them touch more than {@code minDistinctChannels}
 * distinct channels within less than {@code maxSpanMs}.
 * </p>
 */
public class RapidChannelSwitchingPattern implements AttackPattern {

    public static final String NAME = "rapid_channel_switching";

    private final int minEvents;
    private final int lookback;
    private final int minDistinctChannels;
    private final long maxSpanMs;

    public RapidChannelSwitchingPattern(PatternSettings.RapidChannelSwitching settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.minEvents = settings.getMinEvents();
        this.lookback = settings.getLookback();
        this.minDistinctChannels = settings.getMinDistinctChannels();
        this.maxSpanMs = settings.getMaxSpanMs();
    }

    @Override
    public boolean detect(EventHistory history) {
        if (history.totalEvents() < minEvents) {
            return false;
        }
        List<SecurityEvent> recent = history.last(lookback);
        if (recent.isEmpty()) {
            return false;
        }

        Set<String> channels = new HashSet<>();
        for (SecurityEvent event : recent) {
            event.getChannel()
                    .filter(channel -> !channel.isEmpty())
                    .ifPresent(channels::add);
        }
        long span = recent.get(recent.size() - 1).getTimestampMillis() - recent.get(0).getTimestampMillis();

        return channels.size() > minDistinctChannels && span < maxSpanMs;
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
