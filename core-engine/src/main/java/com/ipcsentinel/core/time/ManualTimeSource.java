package com.ipcsentinel.core.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TimeSource} that only moves when told to.
 *
 * <p>
 * Used to make window and refill arithmetic deterministic. Safe to share
 * between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class ManualTimeSource implements TimeSource {

    private final AtomicLong now;

    public ManualTimeSource(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    /**
     * Move the clock forward.
     *
     * @param millis amount to advance; must not be negative
     * @return the new current time
     * @throws IllegalArgumentException if {@code millis} is negative
     */
    public long advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Cannot move time backwards: " + millis);
        }
        return now.addAndGet(millis);
    }

    public void set(long millis) {
        now.set(millis);
    }

    @Override
    public String toString() {
        return "ManualTimeSource{now=" + now.get() + '}';
    }
}
