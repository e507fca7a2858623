package com.ipcsentinel.core.ratelimit;

import java.util.Objects;

/**
 * Sliding-window limit for one channel: at most {@code maxRequests} calls per
 * key within any {@code windowMs} span.
 *
 * @since 1.0.0
 */
public final class RateRule {

    private final String channel;
    private final int maxRequests;
    private final long windowMs;
    private final KeyGenerator keyGenerator;

    /**
     * @throws IllegalArgumentException if {@code maxRequests} or
     *                                  {@code windowMs} is not positive
     */
    public RateRule(String channel, int maxRequests, long windowMs, KeyGenerator keyGenerator) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        if (maxRequests <= 0) {
            throw new IllegalArgumentException(
                    "maxRequests must be > 0 for channel '" + channel + "', got: " + maxRequests);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException(
                    "windowMs must be > 0 for channel '" + channel + "', got: " + windowMs);
        }
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.keyGenerator = keyGenerator != null ? keyGenerator : KeyGenerator.PER_CHANNEL_AND_SENDER;
    }

    public RateRule(String channel, int maxRequests, long windowMs) {
        this(channel, maxRequests, windowMs, KeyGenerator.PER_CHANNEL_AND_SENDER);
    }

    public String getChannel() {
        return channel;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public long getWindowMs() {
        return windowMs;
    }

    public KeyGenerator getKeyGenerator() {
        return keyGenerator;
    }

    String keyFor(String senderId) {
        return keyGenerator.generate(channel, senderId);
    }

    @Override
    public String toString() {
        return "RateRule{" +
                "channel='" + channel + '\'' +
                ", maxRequests=" + maxRequests +
                ", windowMs=" + windowMs +
                '}';
    }
}
