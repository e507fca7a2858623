package com.ipcsentinel.core.monitor;

import com.ipcsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link AlertSink}: writes each alert to the log at WARN.
 */
public class LoggingAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void onAlert(Alert alert) {
        LOG.warn("SECURITY ALERT: {}", alert);
    }
}
