package com.ipcsentinel.core.exception;

/**
 * Thrown when {@code execute} is called for a channel with no registered handler.
 */
public class ChannelNotRegisteredException extends IpcSecurityException {

    private static final long serialVersionUID = 1L;

    public ChannelNotRegisteredException(String channel, String message) {
        super(channel, message);
    }
}
