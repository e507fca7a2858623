package com.ipcsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single security-relevant occurrence recorded by the security monitor.
 *
 * <p>
 * Instances are immutable. The {@code details} map is copied on construction
 * and exposed read-only; well-known keys are {@code channel},
 * {@code senderId}, {@code reason}, {@code origin} and {@code error}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code type}, {@code severity} and
 * {@code timestamp} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class SecurityEvent {

    public static final String DETAIL_CHANNEL = "channel";
    public static final String DETAIL_SENDER_ID = "senderId";

    private final String id;
    private final String type;
    private final Severity severity;
    private final Map<String, Object> details;
    private final Instant timestamp;

    private SecurityEvent(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.details = builder.details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.details))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SecurityEvent}.
     */
    public static class Builder {
        private String id;
        private String type;
        private Severity severity;
        private Map<String, Object> details;
        private Instant timestamp;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder details(Map<String, ?> details) {
            this.details = details != null ? new LinkedHashMap<>(details) : null;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public SecurityEvent build() {
            return new SecurityEvent(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return unmodifiable details map, never {@code null}
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public long getTimestampMillis() {
        return timestamp.toEpochMilli();
    }

    /**
     * Look up a detail value as a string.
     *
     * @param key detail key
     * @return the value's string form, or empty when absent
     */
    public Optional<String> getStringDetail(String key) {
        Object raw = details.get(key);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * @return the {@code channel} detail, if any
     */
    @JsonIgnore
    public Optional<String> getChannel() {
        return getStringDetail(DETAIL_CHANNEL);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SecurityEvent that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "SecurityEvent{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", severity=" + severity +
                ", details=" + details +
                ", timestamp=" + timestamp +
                '}';
    }
}
