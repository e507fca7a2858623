package com.ipcsentinel.core.time;

/**
 * {@link TimeSource} backed by the system clock.
 *
 * @since 1.0.0
 */
public final class SystemTimeSource implements TimeSource {

    static final SystemTimeSource INSTANCE = new SystemTimeSource();

    private SystemTimeSource() {
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return "SystemTimeSource";
    }
}
