package com.ipcsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of alert raised by the security monitor.
 */
public enum AlertType {
    /** A registered per-type threshold was reached. */
    THRESHOLD_EXCEEDED,
    /** A named attack-pattern heuristic matched the recent event history. */
    ATTACK_PATTERN_DETECTED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
