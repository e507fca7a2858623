package com.ipcsentinel.core.time;

/**
 * Source of wall-clock time in epoch milliseconds.
 *
 * <p>
 * Every time-dependent component (sliding windows, token buckets, blacklist
 * expiry, event timestamps) reads the clock through this interface so that
 * tests can substitute a {@link ManualTimeSource}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * @return current time in milliseconds since the epoch
     */
    long currentTimeMillis();

    /**
     * @return a time source backed by {@link System#currentTimeMillis()}
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
