package com.ipcsentinel.core.exception;

/**
 * Thrown at registration time for a reserved channel name or inconsistent options.
 */
public class ConfigurationException extends IpcSecurityException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String channel, String message) {
        super(channel, message);
    }

    public ConfigurationException(String message) {
        super(null, message);
    }
}
