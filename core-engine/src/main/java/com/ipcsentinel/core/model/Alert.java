package com.ipcsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Alert raised when a threshold is reached or an attack pattern matches.
 *
 * <p>
 * Threshold alerts carry {@code eventType}, {@code count}, {@code threshold}
 * and {@code windowMs}; pattern alerts carry {@code pattern} and
 * {@code severity}. Two alerts describe the same condition when their
 * {@code (type, eventType, pattern)} triples match, which is what the monitor
 * deduplicates on.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code type} and {@code timestamp} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alert {

    private final AlertType type;
    private final String eventType;
    private final String pattern;
    private final Severity severity;
    private final Integer count;
    private final Integer threshold;
    private final Long windowMs;
    private final Instant timestamp;

    private Alert(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.eventType = builder.eventType;
        this.pattern = builder.pattern;
        this.severity = builder.severity;
        this.count = builder.count;
        this.threshold = builder.threshold;
        this.windowMs = builder.windowMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private AlertType type;
        private String eventType;
        private String pattern;
        private Severity severity;
        private Integer count;
        private Integer threshold;
        private Long windowMs;
        private Instant timestamp;

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder windowMs(long windowMs) {
            this.windowMs = windowMs;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    public AlertType getType() {
        return type;
    }

    public String getEventType() {
        return eventType;
    }

    public String getPattern() {
        return pattern;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Integer getCount() {
        return count;
    }

    public Integer getThreshold() {
        return threshold;
    }

    public Long getWindowMs() {
        return windowMs;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public long getTimestampMillis() {
        return timestamp.toEpochMilli();
    }

    /**
     * @param other another alert
     * @return {@code true} if both alerts report the same condition
     */
    public boolean describesSameCondition(Alert other) {
        return other != null
                && type == other.type
                && Objects.equals(eventType, other.eventType)
                && Objects.equals(pattern, other.pattern);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return type == alert.type
                && Objects.equals(eventType, alert.eventType)
                && Objects.equals(pattern, alert.pattern)
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, eventType, pattern, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "type=" + type +
                (eventType != null ? ", eventType='" + eventType + '\'' : "") +
                (pattern != null ? ", pattern='" + pattern + '\'' : "") +
                (severity != null ? ", severity=" + severity : "") +
                (count != null ? ", count=" + count : "") +
                (threshold != null ? ", threshold=" + threshold : "") +
                (windowMs != null ? ", windowMs=" + windowMs : "") +
                ", timestamp=" + timestamp +
                '}';
    }
}
