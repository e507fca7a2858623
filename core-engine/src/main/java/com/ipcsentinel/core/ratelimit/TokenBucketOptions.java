package com.ipcsentinel.core.ratelimit;

/**
 * Shape of a token bucket: how many tokens it holds and how fast it refills.
 *
 * @since 1.0.0
 */
public final class TokenBucketOptions {

    private final double capacity;
    private final double refillRate;

    /**
     * @param capacity   maximum number of tokens
     * @param refillRate tokens added per second
     * @throws IllegalArgumentException if either value is not positive
     */
    public TokenBucketOptions(double capacity, double refillRate) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("Refill rate must be positive: " + refillRate);
        }
        this.capacity = capacity;
        this.refillRate = refillRate;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getRefillRate() {
        return refillRate;
    }

    @Override
    public String toString() {
        return String.format("TokenBucketOptions(capacity=%.1f, refillRate=%.2f/sec)", capacity, refillRate);
    }
}
