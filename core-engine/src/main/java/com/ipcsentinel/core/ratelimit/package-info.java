/**
 * Rate limiting for IPC channels: sliding-window rules, token buckets and a
 * time-bounded sender blacklist, all in
 * {@link com.ipcsentinel.core.ratelimit.RateLimiter}.
 *
 * @since 1.0.0
 */
package com.ipcsentinel.core.ratelimit;
