package com.ipcsentinel.core.ratelimit;

/**
 * Mutable token-bucket state for one key.
 *
 * <p>
 * Starts full. Tokens are refilled lazily on each {@link #tryConsume} call by
 * {@code elapsedSeconds * refillRate}, capped at capacity, so
 * {@code 0 <= tokens <= capacity} always holds. All access is synchronized on
 * the bucket.
 * </p>
 */
final class TokenBucket {

    private final double capacity;
    private final double refillRate;
    private double tokens;
    private long lastRefillTime;

    TokenBucket(TokenBucketOptions options, long now) {
        this.capacity = options.getCapacity();
        this.refillRate = options.getRefillRate();
        this.tokens = options.getCapacity();
        this.lastRefillTime = now;
    }

    synchronized boolean tryConsume(double requested, long now) {
        refill(now);
        if (tokens >= requested) {
            tokens -= requested;
            return true;
        }
        return false;
    }

    synchronized double availableTokens(long now) {
        refill(now);
        return tokens;
    }

    private void refill(long now) {
        long elapsed = Math.max(0, now - lastRefillTime);
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + (elapsed / 1000.0) * refillRate);
            lastRefillTime = now;
        }
    }
}
