package com.ipcsentinel.core.config;

/**
 * Settings for blacklisting repeat rate-limit offenders with a doubling
 * duration: {@code min(baseMs * 2^(violations - 1), maxMs)}.
 *
 * <p>
 * Disabled by default; when disabled a denied call only raises an event.
 * </p>
 *
 * @since 1.0.0
 */
public class ProgressiveBlacklistConfig {

    private boolean enabled = false;
    private long baseMs = 1_000;
    private long maxMs = 60_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getBaseMs() {
        return baseMs;
    }

    public void setBaseMs(long baseMs) {
        this.baseMs = baseMs;
    }

    public long getMaxMs() {
        return maxMs;
    }

    public void setMaxMs(long maxMs) {
        this.maxMs = maxMs;
    }

    @Override
    public String toString() {
        return "ProgressiveBlacklistConfig{" +
                "enabled=" + enabled +
                ", baseMs=" + baseMs +
                ", maxMs=" + maxMs +
                '}';
    }
}
