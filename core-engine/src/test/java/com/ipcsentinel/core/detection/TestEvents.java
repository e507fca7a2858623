package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds event histories for pattern tests.
 */
final class TestEvents {

    private TestEvents() {
    }

    static SecurityEvent event(String type, String channel, long timestampMs) {
        return SecurityEvent.builder()
                .id("SEC-" + timestampMs + "-" + channel)
                .type(type)
                .severity(Severity.MEDIUM)
                .details(channel != null ? Map.of(SecurityEvent.DETAIL_CHANNEL, channel) : Map.of())
                .timestamp(Instant.ofEpochMilli(timestampMs))
                .build();
    }

    /** Events at the given offsets from {@code start}, all on one channel. */
    static List<SecurityEvent> atOffsets(String type, long start, long... offsets) {
        List<SecurityEvent> events = new ArrayList<>();
        for (long offset : offsets) {
            events.add(event(type, "ch", start + offset));
        }
        return events;
    }

    static EventHistory history(List<SecurityEvent> events, long now) {
        return new EventHistory(events, events.size(), now);
    }
}
