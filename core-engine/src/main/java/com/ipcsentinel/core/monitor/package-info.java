/**
 * Security event log, thresholds, alerting and metrics.
 *
 * <p>
 * {@link com.ipcsentinel.core.monitor.SecurityMonitor} is the single place
 * events are recorded; alerts leave it through an
 * {@link com.ipcsentinel.core.monitor.AlertSink}.
 * </p>
 *
 * @since 1.0.0
 */
package com.ipcsentinel.core.monitor;
