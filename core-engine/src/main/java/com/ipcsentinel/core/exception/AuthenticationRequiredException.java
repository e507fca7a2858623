package com.ipcsentinel.core.exception;

/**
 * Thrown when a channel requires authentication and the caller has none.
 */
public class AuthenticationRequiredException extends IpcSecurityException {

    private static final long serialVersionUID = 1L;

    public AuthenticationRequiredException(String channel, String message) {
        super(channel, message);
    }
}
