package com.ipcsentinel.core.monitor;

import com.ipcsentinel.core.config.GuardConfig;
import com.ipcsentinel.core.detection.AttackPattern;
import com.ipcsentinel.core.detection.AttackPatternFactory;
import com.ipcsentinel.core.detection.EventHistory;
import com.ipcsentinel.core.model.Alert;
import com.ipcsentinel.core.model.AlertType;
import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.model.Severity;
import com.ipcsentinel.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Records security events, evaluates thresholds and attack patterns over
 * them, and raises deduplicated alerts.
 *
 * <h3>Event log</h3>
 * <p>
 * Events are kept in arrival order, capped at {@code maxEvents}; the oldest
 * event is dropped when the cap is exceeded. Nothing is persisted.
 * </p>
 *
 * <h3>Alerts</h3>
 * <p>
 * After each event the threshold for its type (if any) and every attack
 * pattern are evaluated. An alert is suppressed when an alert for the same
 * {@code (type, eventType, pattern)} was raised within the dedup window
 * (five minutes by default). Surviving alerts are stored and handed to the
 * {@link AlertSink} after the lock is released; sink failures are logged and
 * dropped.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All state is guarded by one lock, so append-then-evict and the checks that
 * follow it are atomic with respect to other loggers and readers. Query
 * methods return copies.
 * </p>
 *
 * <p>
 * Thresholds and patterns are fixed at construction.
 * </p>
 *
 * @since 1.0.0
 */
public class SecurityMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(SecurityMonitor.class);

    public static final int DEFAULT_MAX_EVENTS = 10_000;
    public static final long DEFAULT_DEDUP_WINDOW_MS = 300_000L;
    public static final long DEFAULT_RETENTION_MS = 86_400_000L;
    public static final int DEFAULT_RECENT_COUNT = 100;
    public static final int DEFAULT_FLOOD_THRESHOLD = 100;

    static final long FLOOD_WINDOW_MS = 1_000L;
    static final long FIVE_MINUTES_MS = 300_000L;
    static final long ONE_HOUR_MS = 3_600_000L;

    private static final char[] ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private final TimeSource timeSource;
    private final AlertSink alertSink;
    private final int maxEvents;
    private final long dedupWindowMs;
    private final long retentionMs;
    private final Map<String, Threshold> thresholds;
    private final List<AttackPattern> patterns;
    private final int patternLookback;

    private final Object lock = new Object();
    private final Deque<SecurityEvent> events = new ArrayDeque<>();
    private final List<Alert> alerts = new ArrayList<>();

    private SecurityMonitor(Builder b) {
        this.timeSource = Objects.requireNonNull(b.timeSource, "timeSource must not be null");
        this.alertSink = Objects.requireNonNull(b.alertSink, "alertSink must not be null");
        this.maxEvents = b.maxEvents;
        this.dedupWindowMs = b.dedupWindowMs;
        this.retentionMs = b.retentionMs;

        Map<String, Threshold> byType = new LinkedHashMap<>();
        for (Threshold threshold : b.thresholds) {
            byType.put(threshold.getEventType(), threshold);
        }
        this.thresholds = Collections.unmodifiableMap(byType);
        this.patterns = List.copyOf(b.patterns);
        this.patternLookback = patterns.stream().mapToInt(AttackPattern::getLookback).max().orElse(0);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Logging
    // ---------------------------------------------------------------

    /**
     * Record an event, then run the threshold for its type and every attack
     * pattern.
     *
     * @param type     event type, e.g. {@code rate_limit_exceeded}
     * @param severity event severity
     * @param details  free-form details; copied
     * @return the stored event with its assigned id and timestamp
     */
    public SecurityEvent logSecurityEvent(String type, Severity severity, Map<String, ?> details) {
        Objects.requireNonNull(type, "Event type must not be null");
        Objects.requireNonNull(severity, "Severity must not be null");

        SecurityEvent event;
        List<Alert> raised = new ArrayList<>();
        synchronized (lock) {
            long now = timeSource.currentTimeMillis();
            event = SecurityEvent.builder()
                    .id(nextId(now))
                    .type(type)
                    .severity(severity)
                    .details(details)
                    .timestamp(Instant.ofEpochMilli(now))
                    .build();

            events.addLast(event);
            while (events.size() > maxEvents) {
                events.pollFirst();
            }

            evaluateThreshold(type, now, raised);
            evaluatePatterns(now, raised);
        }

        if (severity.isHighOrAbove()) {
            LOG.warn("Security event {} [{}] {}", type, severity.label(), event.getDetails());
        } else {
            LOG.info("Security event {} [{}] {}", type, severity.label(), event.getDetails());
        }

        deliver(raised);
        return event;
    }

    /**
     * Evaluate the threshold registered for {@code type}, raising an alert
     * when it is reached.
     */
    public void checkThresholds(String type) {
        List<Alert> raised = new ArrayList<>();
        synchronized (lock) {
            evaluateThreshold(type, timeSource.currentTimeMillis(), raised);
        }
        deliver(raised);
    }

    /**
     * Evaluate every attack pattern against the current log.
     */
    public void checkAttackPatterns() {
        List<Alert> raised = new ArrayList<>();
        synchronized (lock) {
            evaluatePatterns(timeSource.currentTimeMillis(), raised);
        }
        deliver(raised);
    }

    /**
     * Store and publish an alert unless the same condition was alerted within
     * the dedup window.
     *
     * @return {@code true} if the alert was stored
     */
    public boolean triggerAlert(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        boolean stored;
        synchronized (lock) {
            stored = storeAlert(alert, timeSource.currentTimeMillis());
        }
        if (stored) {
            deliver(List.of(alert));
        }
        return stored;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return the last {@value #DEFAULT_RECENT_COUNT} events, oldest first
     */
    public List<SecurityEvent> getRecentEvents() {
        return getRecentEvents(DEFAULT_RECENT_COUNT);
    }

    /**
     * @param count maximum number of events
     * @return the last {@code count} events, oldest first
     */
    public List<SecurityEvent> getRecentEvents(int count) {
        synchronized (lock) {
            return tail(count);
        }
    }

    /**
     * @return every stored event of the given type
     */
    public List<SecurityEvent> getEventsByType(String type) {
        return getEventsByType(type, 0);
    }

    /**
     * @param type     event type
     * @param windowMs only events newer than {@code now - windowMs}; zero or
     *                 negative means no time limit
     * @return matching events, oldest first
     */
    public List<SecurityEvent> getEventsByType(String type, long windowMs) {
        synchronized (lock) {
            long cutoff = windowMs > 0 ? timeSource.currentTimeMillis() - windowMs : Long.MIN_VALUE;
            List<SecurityEvent> result = new ArrayList<>();
            for (SecurityEvent event : events) {
                if (event.getType().equals(type) && event.getTimestampMillis() > cutoff) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    /**
     * @return events with severity {@code HIGH} or {@code CRITICAL}
     */
    public List<SecurityEvent> getHighSeverityEvents() {
        synchronized (lock) {
            List<SecurityEvent> result = new ArrayList<>();
            for (SecurityEvent event : events) {
                if (event.getSeverity().isHighOrAbove()) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    /**
     * @return copy of the stored alerts, oldest first
     */
    public List<Alert> getAlerts() {
        synchronized (lock) {
            return new ArrayList<>(alerts);
        }
    }

    /**
     * @see #detectFloodingAttack(String, int)
     */
    public boolean detectFloodingAttack(String senderId) {
        return detectFloodingAttack(senderId, DEFAULT_FLOOD_THRESHOLD);
    }

    /**
     * @return {@code true} if more than {@code threshold} events carrying this
     *         {@code senderId} were logged during the last second
     */
    public boolean detectFloodingAttack(String senderId, int threshold) {
        synchronized (lock) {
            long now = timeSource.currentTimeMillis();
            int count = 0;
            Iterator<SecurityEvent> it = events.descendingIterator();
            while (it.hasNext()) {
                SecurityEvent event = it.next();
                if (now - event.getTimestampMillis() >= FLOOD_WINDOW_MS) {
                    break;
                }
                if (event.getStringDetail(SecurityEvent.DETAIL_SENDER_ID).filter(senderId::equals).isPresent()) {
                    count++;
                }
            }
            return count > threshold;
        }
    }

    /**
     * @return rolling counters over the current log
     */
    public SecurityMetrics getMetrics() {
        synchronized (lock) {
            long now = timeSource.currentTimeMillis();
            int last5Min = 0;
            int lastHour = 0;
            Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
            for (SecurityEvent event : events) {
                long ts = event.getTimestampMillis();
                if (ts > now - FIVE_MINUTES_MS) {
                    last5Min++;
                }
                if (ts > now - ONE_HOUR_MS) {
                    lastHour++;
                }
                bySeverity.merge(event.getSeverity(), 1L, Long::sum);
            }
            return new SecurityMetrics(events.size(), last5Min, lastHour, alerts.size(), bySeverity);
        }
    }

    public Map<String, Threshold> getThresholds() {
        return thresholds;
    }

    public List<AttackPattern> getPatterns() {
        return patterns;
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * Drop events and alerts older than the retention period (24 hours by
     * default). Hosts call this on a schedule.
     */
    public void cleanup() {
        synchronized (lock) {
            long cutoff = timeSource.currentTimeMillis() - retentionMs;
            int eventsBefore = events.size();
            int alertsBefore = alerts.size();
            events.removeIf(event -> event.getTimestampMillis() <= cutoff);
            alerts.removeIf(alert -> alert.getTimestampMillis() <= cutoff);
            LOG.debug("Security monitor cleanup: events {} -> {}, alerts {} -> {}",
                    eventsBefore, events.size(), alertsBefore, alerts.size());
        }
    }

    // ---------------------------------------------------------------
    // Internal (caller holds the lock)
    // ---------------------------------------------------------------

    private void evaluateThreshold(String type, long now, List<Alert> raised) {
        Threshold threshold = thresholds.get(type);
        if (threshold == null) {
            return;
        }

        int count = 0;
        Iterator<SecurityEvent> it = events.descendingIterator();
        while (it.hasNext()) {
            SecurityEvent event = it.next();
            if (now - event.getTimestampMillis() >= threshold.getWindowMs()) {
                break;
            }
            if (event.getType().equals(type)) {
                count++;
            }
        }

        if (count >= threshold.getCount()) {
            Alert alert = Alert.builder()
                    .type(AlertType.THRESHOLD_EXCEEDED)
                    .eventType(type)
                    .count(count)
                    .threshold(threshold.getCount())
                    .windowMs(threshold.getWindowMs())
                    .timestamp(Instant.ofEpochMilli(now))
                    .build();
            if (storeAlert(alert, now)) {
                raised.add(alert);
            }
        }
    }

    private void evaluatePatterns(long now, List<Alert> raised) {
        if (patterns.isEmpty()) {
            return;
        }
        EventHistory history = new EventHistory(tail(patternLookback), events.size(), now);
        for (AttackPattern pattern : patterns) {
            boolean matched;
            try {
                matched = pattern.detect(history);
            } catch (RuntimeException e) {
                LOG.error("Attack pattern '{}' failed: {}", pattern.getName(), e.getMessage(), e);
                continue;
            }
            if (matched) {
                Alert alert = Alert.builder()
                        .type(AlertType.ATTACK_PATTERN_DETECTED)
                        .pattern(pattern.getName())
                        .severity(pattern.getSeverity())
                        .timestamp(Instant.ofEpochMilli(now))
                        .build();
                if (storeAlert(alert, now)) {
                    raised.add(alert);
                }
            }
        }
    }

    private boolean storeAlert(Alert alert, long now) {
        for (int i = alerts.size() - 1; i >= 0; i--) {
            Alert existing = alerts.get(i);
            if (existing.describesSameCondition(alert)
                    && now - existing.getTimestampMillis() < dedupWindowMs) {
                LOG.debug("Suppressed duplicate alert {}", alert);
                return false;
            }
        }
        alerts.add(alert);
        return true;
    }

    private List<SecurityEvent> tail(int count) {
        int n = Math.min(Math.max(count, 0), events.size());
        SecurityEvent[] slice = new SecurityEvent[n];
        Iterator<SecurityEvent> it = events.descendingIterator();
        for (int i = n - 1; i >= 0; i--) {
            slice[i] = it.next();
        }
        List<SecurityEvent> result = new ArrayList<>(n);
        Collections.addAll(result, slice);
        return result;
    }

    private void deliver(List<Alert> raised) {
        for (Alert alert : raised) {
            try {
                alertSink.onAlert(alert);
            } catch (RuntimeException e) {
                LOG.error("Alert sink failed for {}: {}", alert, e.getMessage(), e);
            }
        }
    }

    private static String nextId(long now) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder("SEC-").append(now).append('-');
        for (int i = 0; i < 9; i++) {
            id.append(ID_ALPHABET[random.nextInt(ID_ALPHABET.length)]);
        }
        return id.toString();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SecurityMonitor}.
     *
     * <p>
     * Defaults: system time, {@link LoggingAlertSink}, no thresholds, no
     * patterns. Use {@link #config(GuardConfig)} to pick up the configured
     * thresholds and the built-in patterns.
     * </p>
     */
    public static class Builder {
        private TimeSource timeSource = TimeSource.system();
        private AlertSink alertSink = new LoggingAlertSink();
        private int maxEvents = DEFAULT_MAX_EVENTS;
        private long dedupWindowMs = DEFAULT_DEDUP_WINDOW_MS;
        private long retentionMs = DEFAULT_RETENTION_MS;
        private final List<Threshold> thresholds = new ArrayList<>();
        private final List<AttackPattern> patterns = new ArrayList<>();

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder alertSink(AlertSink alertSink) {
            this.alertSink = alertSink;
            return this;
        }

        public Builder maxEvents(int maxEvents) {
            this.maxEvents = maxEvents;
            return this;
        }

        public Builder dedupWindowMs(long dedupWindowMs) {
            this.dedupWindowMs = dedupWindowMs;
            return this;
        }

        public Builder retentionMs(long retentionMs) {
            this.retentionMs = retentionMs;
            return this;
        }

        public Builder threshold(String eventType, int count, long windowMs) {
            return threshold(new Threshold(eventType, count, windowMs));
        }

        public Builder threshold(Threshold threshold) {
            this.thresholds.add(Objects.requireNonNull(threshold, "threshold must not be null"));
            return this;
        }

        public Builder pattern(AttackPattern pattern) {
            this.patterns.add(Objects.requireNonNull(pattern, "pattern must not be null"));
            return this;
        }

        public Builder patterns(List<? extends AttackPattern> patterns) {
            patterns.forEach(this::pattern);
            return this;
        }

        /**
         * Take capacity, retention, dedup window, thresholds and the built-in
         * patterns from a configuration.
         */
        public Builder config(GuardConfig config) {
            Objects.requireNonNull(config, "GuardConfig must not be null");
            this.maxEvents = config.getMaxEvents();
            this.dedupWindowMs = config.getAlertDedupWindowMs();
            this.retentionMs = config.getEventRetentionMs();
            config.getThresholds().forEach(t -> threshold(Threshold.from(t)));
            patterns(AttackPatternFactory.createAll(config.getPatterns()));
            return this;
        }

        /**
         * @throws IllegalArgumentException if a limit is out of range
         */
        public SecurityMonitor build() {
            if (maxEvents < 1) {
                throw new IllegalArgumentException("maxEvents must be >= 1, got: " + maxEvents);
            }
            if (dedupWindowMs < 0) {
                throw new IllegalArgumentException("dedupWindowMs must be >= 0, got: " + dedupWindowMs);
            }
            if (retentionMs <= 0) {
                throw new IllegalArgumentException("retentionMs must be > 0, got: " + retentionMs);
            }
            return new SecurityMonitor(this);
        }
    }
}
