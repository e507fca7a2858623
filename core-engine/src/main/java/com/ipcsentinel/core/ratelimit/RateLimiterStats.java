package com.ipcsentinel.core.ratelimit;

/**
 * Point-in-time counters of a {@link RateLimiter}.
 */
public final class RateLimiterStats {

    private final int activeKeys;
    private final int blacklistedSenders;
    private final long totalRequests;

    public RateLimiterStats(int activeKeys, int blacklistedSenders, long totalRequests) {
        this.activeKeys = activeKeys;
        this.blacklistedSenders = blacklistedSenders;
        this.totalRequests = totalRequests;
    }

    /**
     * @return request-log keys currently tracked
     */
    public int getActiveKeys() {
        return activeKeys;
    }

    /**
     * @return senders currently blacklisted
     */
    public int getBlacklistedSenders() {
        return blacklistedSenders;
    }

    /**
     * @return timestamps held across all request logs
     */
    public long getTotalRequests() {
        return totalRequests;
    }

    @Override
    public String toString() {
        return "RateLimiterStats{" +
                "activeKeys=" + activeKeys +
                ", blacklistedSenders=" + blacklistedSenders +
                ", totalRequests=" + totalRequests +
                '}';
    }
}
