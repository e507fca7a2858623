package com.ipcsentinel.core.exception;

/**
 * Wraps a checked exception thrown by a business handler.
 *
 * <p>
 * Unchecked exceptions from handlers are rethrown as they are; only checked
 * ones need a carrier.
 * </p>
 */
public class HandlerException extends IpcSecurityException {

    private static final long serialVersionUID = 1L;

    public HandlerException(String channel, Throwable cause) {
        super(channel, "Handler for channel '" + channel + "' failed: " + cause.getMessage(), cause);
    }
}
