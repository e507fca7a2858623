package com.ipcsentinel.core.monitor;

import com.ipcsentinel.core.model.Alert;

/**
 * Receives alerts once they pass deduplication.
 *
 * <p>
 * Called outside the monitor's lock, possibly from several threads at once.
 * Exceptions are caught and logged by the monitor; they never reach the IPC
 * pipeline.
 * </p>
 */
@FunctionalInterface
public interface AlertSink {

    void onAlert(Alert alert);
}
