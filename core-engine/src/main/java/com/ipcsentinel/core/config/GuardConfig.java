package com.ipcsentinel.core.config;

import com.ipcsentinel.core.model.EventTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the guard YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * maxEvents: 10000
 * alertDedupWindowMs: 300000
 * eventRetentionMs: 86400000
 * requestRetentionMs: 3600000
 * defaultBlacklistDurationMs: 3600000
 * progressiveBlacklist:
 *   enabled: false
 *   baseMs: 1000
 *   maxMs: 60000
 * reservedChannelPrefixes:
 *   - ELECTRON_BROWSER_REQUIRE
 * thresholds:
 *   - eventType: rate_limit_exceeded
 *     count: 10
 *     windowMs: 60000
 * patterns:
 *   automatedAttack:
 *     maxVariance: 100
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; the loader does so automatically.
 * </p>
 *
 * @since 1.0.0
 */
public class GuardConfig {

    /** Channel-name prefixes owned by the IPC framework itself. */
    public static final List<String> DEFAULT_RESERVED_PREFIXES = List.of(
            "ELECTRON_BROWSER_REQUIRE",
            "ELECTRON_BROWSER_GET_BUILTIN",
            "ELECTRON_BROWSER_MEMBER_GET",
            "ELECTRON_BROWSER_MEMBER_SET",
            "ELECTRON_BROWSER_MEMBER_CALL");

    private int maxEvents = 10_000;
    private long alertDedupWindowMs = 300_000;
    private long eventRetentionMs = 86_400_000;
    private long requestRetentionMs = 3_600_000;
    private long defaultBlacklistDurationMs = 3_600_000;
    private ProgressiveBlacklistConfig progressiveBlacklist = new ProgressiveBlacklistConfig();
    private List<String> reservedChannelPrefixes = new ArrayList<>(DEFAULT_RESERVED_PREFIXES);
    private List<ThresholdConfig> thresholds = defaultThresholds();
    private PatternSettings patterns = new PatternSettings();

    /**
     * @return a configuration holding only defaults
     */
    public static GuardConfig defaults() {
        return new GuardConfig();
    }

    /**
     * The four stock thresholds: rate-limit and unauthorized-sender bursts per
     * minute, auth failures and invalid input per five minutes.
     *
     * @return mutable list of default thresholds
     */
    public static List<ThresholdConfig> defaultThresholds() {
        List<ThresholdConfig> list = new ArrayList<>();
        list.add(new ThresholdConfig(EventTypes.RATE_LIMIT_EXCEEDED, 10, 60_000));
        list.add(new ThresholdConfig(EventTypes.AUTH_FAILURE, 5, 300_000));
        list.add(new ThresholdConfig(EventTypes.UNAUTHORIZED_SENDER, 20, 60_000));
        list.add(new ThresholdConfig(EventTypes.INVALID_INPUT, 50, 300_000));
        return list;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section, collecting all problems before failing.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (maxEvents < 1) {
            errors.add("'maxEvents' must be >= 1, got: " + maxEvents);
        }
        if (alertDedupWindowMs < 0) {
            errors.add("'alertDedupWindowMs' must be >= 0, got: " + alertDedupWindowMs);
        }
        if (eventRetentionMs <= 0) {
            errors.add("'eventRetentionMs' must be > 0, got: " + eventRetentionMs);
        }
        if (requestRetentionMs <= 0) {
            errors.add("'requestRetentionMs' must be > 0, got: " + requestRetentionMs);
        }
        if (defaultBlacklistDurationMs <= 0) {
            errors.add("'defaultBlacklistDurationMs' must be > 0, got: " + defaultBlacklistDurationMs);
        }
        if (progressiveBlacklist != null && progressiveBlacklist.isEnabled()) {
            if (progressiveBlacklist.getBaseMs() <= 0) {
                errors.add("'progressiveBlacklist.baseMs' must be > 0");
            }
            if (progressiveBlacklist.getMaxMs() < progressiveBlacklist.getBaseMs()) {
                errors.add("'progressiveBlacklist.maxMs' must be >= baseMs");
            }
        }
        if (reservedChannelPrefixes != null) {
            for (String prefix : reservedChannelPrefixes) {
                if (prefix == null || prefix.isBlank()) {
                    errors.add("'reservedChannelPrefixes' must not contain blank entries");
                    break;
                }
            }
        }

        List<String> seenTypes = new ArrayList<>();
        for (int i = 0; i < thresholds.size(); i++) {
            ThresholdConfig threshold = thresholds.get(i);
            if (threshold == null) {
                errors.add("Threshold at index " + i + " is null");
                continue;
            }
            errors.addAll(threshold.problems());
            if (threshold.getEventType() != null && seenTypes.contains(threshold.getEventType())) {
                errors.add("Duplicate threshold for event type '" + threshold.getEventType() + "'");
            }
            seenTypes.add(threshold.getEventType());
        }

        if (patterns != null) {
            errors.addAll(patterns.problems());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Guard configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getMaxEvents() {
        return maxEvents;
    }

    public void setMaxEvents(int maxEvents) {
        this.maxEvents = maxEvents;
    }

    public long getAlertDedupWindowMs() {
        return alertDedupWindowMs;
    }

    public void setAlertDedupWindowMs(long alertDedupWindowMs) {
        this.alertDedupWindowMs = alertDedupWindowMs;
    }

    public long getEventRetentionMs() {
        return eventRetentionMs;
    }

    public void setEventRetentionMs(long eventRetentionMs) {
        this.eventRetentionMs = eventRetentionMs;
    }

    public long getRequestRetentionMs() {
        return requestRetentionMs;
    }

    public void setRequestRetentionMs(long requestRetentionMs) {
        this.requestRetentionMs = requestRetentionMs;
    }

    public long getDefaultBlacklistDurationMs() {
        return defaultBlacklistDurationMs;
    }

    public void setDefaultBlacklistDurationMs(long defaultBlacklistDurationMs) {
        this.defaultBlacklistDurationMs = defaultBlacklistDurationMs;
    }

    public ProgressiveBlacklistConfig getProgressiveBlacklist() {
        return progressiveBlacklist;
    }

    public void setProgressiveBlacklist(ProgressiveBlacklistConfig progressiveBlacklist) {
        this.progressiveBlacklist = progressiveBlacklist != null
                ? progressiveBlacklist
                : new ProgressiveBlacklistConfig();
    }

    /**
     * @return unmodifiable list of reserved prefixes
     */
    public List<String> getReservedChannelPrefixes() {
        return reservedChannelPrefixes != null
                ? Collections.unmodifiableList(reservedChannelPrefixes)
                : Collections.emptyList();
    }

    public void setReservedChannelPrefixes(List<String> reservedChannelPrefixes) {
        this.reservedChannelPrefixes = reservedChannelPrefixes != null
                ? new ArrayList<>(reservedChannelPrefixes)
                : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of thresholds
     */
    public List<ThresholdConfig> getThresholds() {
        return Collections.unmodifiableList(thresholds);
    }

    public void setThresholds(List<ThresholdConfig> thresholds) {
        this.thresholds = thresholds != null ? new ArrayList<>(thresholds) : new ArrayList<>();
    }

    public PatternSettings getPatterns() {
        return patterns;
    }

    public void setPatterns(PatternSettings patterns) {
        this.patterns = patterns != null ? patterns : new PatternSettings();
    }

    @Override
    public String toString() {
        return "GuardConfig{" +
                "maxEvents=" + maxEvents +
                ", alertDedupWindowMs=" + alertDedupWindowMs +
                ", eventRetentionMs=" + eventRetentionMs +
                ", requestRetentionMs=" + requestRetentionMs +
                ", defaultBlacklistDurationMs=" + defaultBlacklistDurationMs +
                ", progressiveBlacklist=" + progressiveBlacklist +
                ", reservedChannelPrefixes=" + reservedChannelPrefixes +
                ", thresholds=" + thresholds +
                '}';
    }
}
