package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.model.SecurityEvent;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of the monitor's event log handed to attack patterns.
 *
 * <p>
 * Holds the most recent events in chronological order (as many as the
 * longest-looking pattern needs), the total size of the log and the
 * evaluation time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventHistory {

    private final List<SecurityEvent> recent;
    private final int totalEvents;
    private final long now;

    /**
     * @param recent      trailing events, oldest first
     * @param totalEvents number of events in the whole log
     * @param now         evaluation time in epoch millis
     */
    public EventHistory(List<SecurityEvent> recent, int totalEvents, long now) {
        this.recent = Collections.unmodifiableList(Objects.requireNonNull(recent, "recent must not be null"));
        this.totalEvents = totalEvents;
        this.now = now;
    }

    /**
     * @param n maximum number of events
     * @return the last {@code n} events (fewer if the log is shorter), oldest
     *         first
     */
    public List<SecurityEvent> last(int n) {
        int size = recent.size();
        return recent.subList(Math.max(0, size - n), size);
    }

    public int totalEvents() {
        return totalEvents;
    }

    public long now() {
        return now;
    }
}
