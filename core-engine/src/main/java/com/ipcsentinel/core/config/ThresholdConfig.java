package com.ipcsentinel.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * YAML form of a monitor threshold: "alert when {@code count} events of
 * {@code eventType} occur within {@code windowMs}".
 *
 * @since 1.0.0
 */
public class ThresholdConfig {

    private String eventType;
    private int count;
    private long windowMs;

    /** No-arg constructor required by SnakeYAML. */
    public ThresholdConfig() {
    }

    public ThresholdConfig(String eventType, int count, long windowMs) {
        this.eventType = eventType;
        this.count = count;
        this.windowMs = windowMs;
    }

    /**
     * @return list of problems with this entry, empty when valid
     */
    List<String> problems() {
        List<String> errors = new ArrayList<>();
        if (eventType == null || eventType.isBlank()) {
            errors.add("Threshold 'eventType' is required");
        }
        if (count <= 0) {
            errors.add("Threshold '" + eventType + "' requires 'count' > 0");
        }
        if (windowMs <= 0) {
            errors.add("Threshold '" + eventType + "' requires 'windowMs' > 0");
        }
        return errors;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public long getWindowMs() {
        return windowMs;
    }

    public void setWindowMs(long windowMs) {
        this.windowMs = windowMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdConfig that))
            return false;
        return count == that.count && windowMs == that.windowMs
                && Objects.equals(eventType, that.eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, count, windowMs);
    }

    @Override
    public String toString() {
        return "ThresholdConfig{" +
                "eventType='" + eventType + '\'' +
                ", count=" + count +
                ", windowMs=" + windowMs +
                '}';
    }
}
