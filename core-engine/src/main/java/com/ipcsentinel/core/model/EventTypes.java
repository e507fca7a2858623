package com.ipcsentinel.core.model;

/**
 * Event type names emitted by the mediator pipeline.
 *
 * <p>
 * Collaborators may log events of any other type; these are the ones the
 * default thresholds and attack patterns look at.
 * </p>
 */
public final class EventTypes {

    public static final String UNAUTHORIZED_SENDER = "unauthorized_sender";
    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String INVALID_INPUT = "invalid_input";
    public static final String AUTH_FAILURE = "auth_failure";
    public static final String HANDLER_ERROR = "handler_error";

    private EventTypes() {
        // constants holder
    }
}
