package com.ipcsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity attached to every {@link SecurityEvent} and to pattern alerts.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @return lowercase label used in logs and JSON output
     */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return {@code true} for {@link #HIGH} and {@link #CRITICAL}
     */
    public boolean isHighOrAbove() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Parse a severity label, ignoring case.
     *
     * @param value label such as {@code "high"}
     * @return the matching severity
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Severity fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity label must not be blank");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
