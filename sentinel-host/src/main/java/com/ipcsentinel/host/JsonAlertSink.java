package com.ipcsentinel.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ipcsentinel.core.model.Alert;
import com.ipcsentinel.core.monitor.AlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AlertSink} that writes each alert as one JSON line to the
 * {@value #ALERT_LOGGER} logger, so a log appender can ship alerts separately
 * from application logs.
 */
public class JsonAlertSink implements AlertSink {

    public static final String ALERT_LOGGER = "com.ipcsentinel.alerts";

    private static final Logger LOG = LoggerFactory.getLogger(JsonAlertSink.class);
    private static final Logger ALERTS = LoggerFactory.getLogger(ALERT_LOGGER);

    private final ObjectMapper mapper;

    public JsonAlertSink() {
        this(HostJson.newMapper());
    }

    JsonAlertSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void onAlert(Alert alert) {
        String json = toJson(alert);
        if (json != null) {
            ALERTS.warn(json);
        }
    }

    /**
     * @return the alert as JSON, or {@code null} if it cannot be serialized
     */
    String toJson(Alert alert) {
        try {
            return mapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize alert: {}", e.getMessage(), e);
            return null;
        }
    }
}
