/**
 * Runtime host for the IPC guard: environment-driven configuration, the
 * composition root with scheduled cleanup, the JSON alert sink and the
 * health/stats HTTP endpoint.
 *
 * @since 1.0.0
 */
package com.ipcsentinel.host;
