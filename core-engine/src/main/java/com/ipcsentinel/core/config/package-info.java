/**
 * Configuration loading and validation for the guard.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.ipcsentinel.core.config.GuardConfigLoader} into a
 * {@link com.ipcsentinel.core.config.GuardConfig}. Validation runs right after
 * parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.ipcsentinel.core.config;
