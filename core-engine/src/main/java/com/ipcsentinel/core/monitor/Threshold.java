package com.ipcsentinel.core.monitor;

import com.ipcsentinel.core.config.ThresholdConfig;

import java.util.Objects;

/**
 * Alert rule: at least {@code count} events of {@code eventType} within
 * {@code windowMs}.
 */
public final class Threshold {

    private final String eventType;
    private final int count;
    private final long windowMs;

    /**
     * @throws IllegalArgumentException if {@code count} or {@code windowMs} is
     *                                  not positive
     */
    public Threshold(String eventType, int count, long windowMs) {
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
        if (count <= 0) {
            throw new IllegalArgumentException("Threshold count must be > 0 for '" + eventType + "', got: " + count);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("Threshold window must be > 0 for '" + eventType + "', got: " + windowMs);
        }
        this.count = count;
        this.windowMs = windowMs;
    }

    public static Threshold from(ThresholdConfig config) {
        Objects.requireNonNull(config, "ThresholdConfig must not be null");
        return new Threshold(config.getEventType(), config.getCount(), config.getWindowMs());
    }

    public String getEventType() {
        return eventType;
    }

    public int getCount() {
        return count;
    }

    public long getWindowMs() {
        return windowMs;
    }

    @Override
    public String toString() {
        return "Threshold{" + eventType + ": " + count + " per " + windowMs + " ms}";
    }
}
