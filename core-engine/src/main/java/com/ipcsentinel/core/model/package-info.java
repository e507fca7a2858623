/**
 * Domain model shared by the monitor, the detectors and the host.
 *
 * <ul>
 * <li>{@link com.ipcsentinel.core.model.SecurityEvent} – immutable record of a
 * security-relevant occurrence</li>
 * <li>{@link com.ipcsentinel.core.model.Alert} – threshold or attack-pattern
 * alert</li>
 * <li>{@link com.ipcsentinel.core.model.Severity} – event severity scale</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ipcsentinel.core.model;
