package com.ipcsentinel.core.exception;

/**
 * Thrown when the caller is over the channel's rate limit or blacklisted.
 */
public class RateLimitExceededException extends IpcSecurityException {

    private static final long serialVersionUID = 1L;

    public RateLimitExceededException(String channel, String message) {
        super(channel, message);
    }
}
