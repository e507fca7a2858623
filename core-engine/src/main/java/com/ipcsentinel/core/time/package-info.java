/**
 * Injectable time sources.
 *
 * @since 1.0.0
 */
package com.ipcsentinel.core.time;
