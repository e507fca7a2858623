package com.ipcsentinel.core.exception;

/**
 * Base type for every failure raised by the mediator.
 *
 * <p>
 * Each subclass carries the channel the call was made on so that callers can
 * report it without parsing messages.
 * </p>
 *
 * @since 1.0.0
 */
public class IpcSecurityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String channel;

    public IpcSecurityException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public IpcSecurityException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    /**
     * @return channel of the rejected call or registration, may be {@code null}
     */
    public String getChannel() {
        return channel;
    }
}
