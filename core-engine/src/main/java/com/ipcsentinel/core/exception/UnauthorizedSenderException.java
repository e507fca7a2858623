package com.ipcsentinel.core.exception;

/**
 * Thrown when the caller's frame or origin fails sender validation.
 */
public class UnauthorizedSenderException extends IpcSecurityException {

    private static final long serialVersionUID = 1L;

    public UnauthorizedSenderException(String channel, String message) {
        super(channel, message);
    }
}
