package com.ipcsentinel.core.monitor;

import com.ipcsentinel.core.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the monitor's rolling counters.
 */
public final class SecurityMetrics {

    private final int totalEvents;
    private final int eventsLast5Min;
    private final int eventsLastHour;
    private final int alertsTriggered;
    private final Map<String, Long> severityBreakdown;

    SecurityMetrics(int totalEvents, int eventsLast5Min, int eventsLastHour, int alertsTriggered,
            Map<Severity, Long> severityCounts) {
        this.totalEvents = totalEvents;
        this.eventsLast5Min = eventsLast5Min;
        this.eventsLastHour = eventsLastHour;
        this.alertsTriggered = alertsTriggered;
        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            breakdown.put(severity.label(), severityCounts.getOrDefault(severity, 0L));
        }
        this.severityBreakdown = Collections.unmodifiableMap(breakdown);
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    public int getEventsLast5Min() {
        return eventsLast5Min;
    }

    public int getEventsLastHour() {
        return eventsLastHour;
    }

    public int getAlertsTriggered() {
        return alertsTriggered;
    }

    /**
     * @return event counts keyed by severity label, every severity present
     */
    public Map<String, Long> getSeverityBreakdown() {
        return severityBreakdown;
    }

    public long countFor(Severity severity) {
        return severityBreakdown.get(severity.label());
    }

    @Override
    public String toString() {
        return "SecurityMetrics{" +
                "totalEvents=" + totalEvents +
                ", eventsLast5Min=" + eventsLast5Min +
                ", eventsLastHour=" + eventsLastHour +
                ", alertsTriggered=" + alertsTriggered +
                ", severityBreakdown=" + severityBreakdown +
                '}';
    }
}
