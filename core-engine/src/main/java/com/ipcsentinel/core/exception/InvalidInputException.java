package com.ipcsentinel.core.exception;

/**
 * Thrown when a validator rejects the first argument, or a sanitizer refuses it.
 */
public class InvalidInputException extends IpcSecurityException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String channel, String message) {
        super(channel, message);
    }

    public InvalidInputException(String channel, String message, Throwable cause) {
        super(channel, message, cause);
    }
}
