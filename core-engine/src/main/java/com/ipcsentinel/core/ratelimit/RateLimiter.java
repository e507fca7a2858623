package com.ipcsentinel.core.ratelimit;

import com.ipcsentinel.core.config.GuardConfig;
import com.ipcsentinel.core.config.ProgressiveBlacklistConfig;
import com.ipcsentinel.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-key admission control for IPC channels.
 *
 * <h3>Algorithms</h3>
 * <ul>
 * <li><b>Sliding window log</b> ({@link #checkLimit}) – keeps the timestamps
 * of admitted calls per key, drops the ones older than the rule's window and
 * admits while fewer than {@code maxRequests} remain.</li>
 * <li><b>Token bucket</b> ({@link #consumeToken}) – lazily refilled bucket for
 * burst control, independent of the channel rules.</li>
 * <li><b>Blacklist</b> – time-bounded ban consulted before any rule. Entries
 * expire against the {@link TimeSource}; when a scheduler is supplied a
 * cancelable task also frees the entry once its duration has passed.</li>
 * <li><b>Progressive blacklist</b> ({@link #recordViolation}) – repeat
 * offenders are banned for a doubling duration, capped.</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. The prune-count-append sequence for a key runs
 * inside {@link ConcurrentHashMap#compute}, so two calls for the same key
 * never interleave. Buckets synchronize on themselves.
 * </p>
 *
 * <p>
 * No method throws for a rejected call; denial is reported as {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
public class RateLimiter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);

    /** Default ban length for {@link #blacklistSender(String)}. */
    public static final long DEFAULT_BLACKLIST_DURATION_MS = 3_600_000L;

    /** How long {@link #cleanup()} keeps request timestamps. */
    public static final long DEFAULT_REQUEST_RETENTION_MS = 3_600_000L;

    private final TimeSource timeSource;
    private final ScheduledExecutorService scheduler;
    private final long defaultBlacklistDurationMs;
    private final long requestRetentionMs;
    private final long backoffBaseMs;
    private final long backoffMaxMs;

    private final Map<String, RateRule> rules = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Deque<Long>> requests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, BlacklistEntry> blacklist = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ViolationRecord> violations = new ConcurrentHashMap<>();

    private RateLimiter(Builder b) {
        this.timeSource = Objects.requireNonNull(b.timeSource, "timeSource must not be null");
        this.scheduler = b.scheduler;
        this.defaultBlacklistDurationMs = b.defaultBlacklistDurationMs;
        this.requestRetentionMs = b.requestRetentionMs;
        this.backoffBaseMs = b.backoffBaseMs;
        this.backoffMaxMs = b.backoffMaxMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Rule registration
    // ---------------------------------------------------------------

    /**
     * Limit {@code channel} to {@code maxRequests} per {@code windowMs} for
     * each sender (key {@code channel:senderId}).
     *
     * @throws IllegalArgumentException if either bound is not positive
     */
    public void setLimit(String channel, int maxRequests, long windowMs) {
        setCustomLimit(new RateRule(channel, maxRequests, windowMs));
    }

    /**
     * Register a rule with its own key generator, replacing any previous rule
     * for the same channel.
     */
    public void setCustomLimit(RateRule rule) {
        Objects.requireNonNull(rule, "RateRule must not be null");
        rules.put(rule.getChannel(), rule);
        LOG.debug("Registered rate rule {}", rule);
    }

    /**
     * Stop limiting {@code channel}. Request logs already recorded under the
     * channel age out through {@link #cleanup()}.
     *
     * @return {@code true} if a rule was registered for the channel
     */
    public boolean removeLimit(String channel) {
        if (channel == null) {
            return false;
        }
        RateRule removed = rules.remove(channel);
        if (removed != null) {
            LOG.debug("Removed rate rule {}", removed);
        }
        return removed != null;
    }

    /**
     * @return the rule for a channel, or {@code null} if none
     */
    public RateRule getRule(String channel) {
        return rules.get(channel);
    }

    // ---------------------------------------------------------------
    // Sliding window
    // ---------------------------------------------------------------

    /**
     * Decide whether a call from {@code senderId} on {@code channel} may
     * proceed, recording it when admitted.
     *
     * @return {@code false} if the sender is blacklisted or the window is full
     */
    public boolean checkLimit(String channel, String senderId) {
        if (isBlacklisted(senderId)) {
            LOG.debug("Denied {} on {}: sender is blacklisted", senderId, channel);
            return false;
        }

        RateRule rule = rules.get(channel);
        if (rule == null) {
            return true;
        }

        String key = rule.keyFor(senderId);
        long now = timeSource.currentTimeMillis();
        boolean[] admitted = new boolean[1];

        requests.compute(key, (k, log) -> {
            Deque<Long> timestamps = log != null ? log : new ArrayDeque<>();
            evictOlderThan(timestamps, now, rule.getWindowMs());
            if (timestamps.size() < rule.getMaxRequests()) {
                timestamps.addLast(now);
                admitted[0] = true;
            }
            return timestamps.isEmpty() ? null : timestamps;
        });

        if (!admitted[0]) {
            LOG.debug("Denied {} on {}: {} requests within {} ms",
                    senderId, channel, rule.getMaxRequests(), rule.getWindowMs());
        }
        return admitted[0];
    }

    // ---------------------------------------------------------------
    // Token bucket
    // ---------------------------------------------------------------

    /**
     * Take one token from the bucket named {@code key}.
     *
     * @see #consumeToken(String, TokenBucketOptions, double)
     */
    public boolean consumeToken(String key, TokenBucketOptions options) {
        return consumeToken(key, options, 1);
    }

    /**
     * Take {@code tokens} from the bucket named {@code key}, creating a full
     * bucket on first use. The bucket is refilled for the elapsed time before
     * the check; a denied request leaves the balance untouched.
     *
     * @return {@code true} if enough tokens were available
     * @throws IllegalArgumentException if {@code tokens} is not a positive number
     */
    public boolean consumeToken(String key, TokenBucketOptions options, double tokens) {
        Objects.requireNonNull(key, "Bucket key must not be null");
        Objects.requireNonNull(options, "TokenBucketOptions must not be null");
        if (!(tokens > 0) || Double.isInfinite(tokens)) {
            throw new IllegalArgumentException("Requested tokens must be a positive number, got: " + tokens);
        }
        long now = timeSource.currentTimeMillis();
        TokenBucket bucket = buckets.computeIfAbsent(key, k -> new TokenBucket(options, now));
        boolean allowed = bucket.tryConsume(tokens, now);
        if (!allowed) {
            LOG.debug("Token bucket '{}' empty, {} token(s) requested", key, tokens);
        }
        return allowed;
    }

    /**
     * @return tokens currently available in a bucket, or {@code -1} if the
     *         bucket does not exist
     */
    public double availableTokens(String key) {
        TokenBucket bucket = buckets.get(key);
        return bucket != null ? bucket.availableTokens(timeSource.currentTimeMillis()) : -1;
    }

    // ---------------------------------------------------------------
    // Blacklist
    // ---------------------------------------------------------------

    /**
     * Blacklist a sender for the default duration.
     */
    public void blacklistSender(String senderId) {
        blacklistSender(senderId, defaultBlacklistDurationMs);
    }

    /**
     * Blacklist a sender for {@code durationMs}. A sender that is already
     * blacklisted gets the new expiry; its previous removal task is cancelled.
     *
     * @throws IllegalArgumentException if {@code durationMs} is not positive
     */
    public void blacklistSender(String senderId, long durationMs) {
        Objects.requireNonNull(senderId, "senderId must not be null");
        if (durationMs <= 0) {
            throw new IllegalArgumentException("Blacklist duration must be > 0, got: " + durationMs);
        }

        long now = timeSource.currentTimeMillis();
        // saturate so very long bans do not wrap into the past
        long expiresAt = durationMs > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + durationMs;
        BlacklistEntry entry = new BlacklistEntry(expiresAt);
        BlacklistEntry previous = blacklist.put(senderId, entry);
        if (previous != null) {
            previous.cancelRemoval();
        }
        entry.removal = scheduleRemoval(senderId, entry, durationMs);

        LOG.warn("Sender {} blacklisted for {} ms", senderId, durationMs);
    }

    /**
     * @return {@code true} while the sender's ban has not expired
     */
    public boolean isBlacklisted(String senderId) {
        if (senderId == null) {
            return false;
        }
        BlacklistEntry entry = blacklist.get(senderId);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(timeSource.currentTimeMillis())) {
            if (blacklist.remove(senderId, entry)) {
                entry.cancelRemoval();
                LOG.info("Blacklist entry for {} expired", senderId);
            }
            return false;
        }
        return true;
    }

    /**
     * Lift a ban before it expires.
     *
     * @return {@code true} if the sender was blacklisted
     */
    public boolean removeFromBlacklist(String senderId) {
        BlacklistEntry entry = blacklist.remove(senderId);
        if (entry == null) {
            return false;
        }
        entry.cancelRemoval();
        LOG.info("Sender {} removed from blacklist", senderId);
        return true;
    }

    /**
     * Count a rate-limit violation for {@code senderId} and blacklist it for
     * {@code min(base * 2^(n-1), max)} where {@code n} is its violation count.
     *
     * @return the applied blacklist duration in milliseconds
     */
    public long recordViolation(String senderId) {
        Objects.requireNonNull(senderId, "senderId must not be null");
        long now = timeSource.currentTimeMillis();
        ViolationRecord record = violations.compute(senderId, (k, v) -> v == null
                ? new ViolationRecord(1, now)
                : new ViolationRecord(v.count + 1, now));

        long duration = backoffDuration(record.count);
        blacklistSender(senderId, duration);
        return duration;
    }

    /**
     * @return recorded violations for a sender, 0 if none
     */
    public int getViolationCount(String senderId) {
        ViolationRecord record = violations.get(senderId);
        return record != null ? record.count : 0;
    }

    long backoffDuration(int violationCount) {
        int exponent = Math.min(Math.max(violationCount - 1, 0), 30);
        long duration = backoffBaseMs << exponent;
        if (duration <= 0 || duration > backoffMaxMs) {
            return backoffMaxMs;
        }
        return duration;
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * Drop request timestamps older than the retention period (one hour by
     * default), empty logs, expired blacklist entries and stale violation
     * records. Hosts call this on a schedule; nothing here runs on its own.
     */
    public void cleanup() {
        long now = timeSource.currentTimeMillis();
        int keysBefore = requests.size();

        for (String key : requests.keySet()) {
            requests.computeIfPresent(key, (k, log) -> {
                evictOlderThan(log, now, requestRetentionMs);
                return log.isEmpty() ? null : log;
            });
        }

        blacklist.forEach((senderId, entry) -> {
            if (entry.isExpired(now) && blacklist.remove(senderId, entry)) {
                entry.cancelRemoval();
            }
        });

        violations.entrySet().removeIf(e -> now - e.getValue().lastViolationAt >= requestRetentionMs
                && !blacklist.containsKey(e.getKey()));

        LOG.debug("Rate limiter cleanup: {} -> {} active key(s)", keysBefore, requests.size());
    }

    /**
     * @return current counters
     */
    public RateLimiterStats getStats() {
        long[] total = new long[1];
        for (String key : requests.keySet()) {
            requests.computeIfPresent(key, (k, log) -> {
                total[0] += log.size();
                return log;
            });
        }
        long now = timeSource.currentTimeMillis();
        int blacklisted = (int) blacklist.values().stream()
                .filter(entry -> !entry.isExpired(now))
                .count();
        return new RateLimiterStats(requests.size(), blacklisted, total[0]);
    }

    /**
     * Cancel every pending blacklist-removal task and forget all bans. Rules
     * and request logs are kept.
     */
    @Override
    public void close() {
        blacklist.values().forEach(BlacklistEntry::cancelRemoval);
        blacklist.clear();
        LOG.info("Rate limiter closed");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void evictOlderThan(Deque<Long> timestamps, long now, long windowMs) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowMs) {
            timestamps.pollFirst();
        }
    }

    private ScheduledFuture<?> scheduleRemoval(String senderId, BlacklistEntry entry, long durationMs) {
        if (scheduler == null) {
            return null;
        }
        try {
            return scheduler.schedule(() -> {
                if (blacklist.remove(senderId, entry)) {
                    LOG.info("Blacklist entry for {} expired", senderId);
                }
            }, durationMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.warn("Could not schedule blacklist expiry for {}, relying on lazy expiry: {}",
                    senderId, e.getMessage());
            return null;
        }
    }

    private static final class BlacklistEntry {
        private final long expiresAt;
        private volatile ScheduledFuture<?> removal;

        BlacklistEntry(long expiresAt) {
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long now) {
            return now >= expiresAt;
        }

        void cancelRemoval() {
            ScheduledFuture<?> task = removal;
            if (task != null) {
                task.cancel(false);
            }
        }
    }

    private static final class ViolationRecord {
        private final int count;
        private final long lastViolationAt;

        ViolationRecord(int count, long lastViolationAt) {
            this.count = count;
            this.lastViolationAt = lastViolationAt;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RateLimiter}.
     *
     * <p>
     * Only the time source is required. Without a scheduler, blacklist entries
     * still expire, but are only freed on lookup or {@link #cleanup()}.
     * </p>
     */
    public static class Builder {
        private TimeSource timeSource = TimeSource.system();
        private ScheduledExecutorService scheduler;
        private long defaultBlacklistDurationMs = DEFAULT_BLACKLIST_DURATION_MS;
        private long requestRetentionMs = DEFAULT_REQUEST_RETENTION_MS;
        private long backoffBaseMs = 1_000;
        private long backoffMaxMs = 60_000;

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder defaultBlacklistDurationMs(long v) {
            this.defaultBlacklistDurationMs = v;
            return this;
        }

        public Builder requestRetentionMs(long v) {
            this.requestRetentionMs = v;
            return this;
        }

        public Builder backoff(long baseMs, long maxMs) {
            this.backoffBaseMs = baseMs;
            this.backoffMaxMs = maxMs;
            return this;
        }

        /**
         * Copy retention, blacklist and backoff settings from a loaded
         * configuration.
         */
        public Builder config(GuardConfig config) {
            Objects.requireNonNull(config, "GuardConfig must not be null");
            ProgressiveBlacklistConfig progressive = config.getProgressiveBlacklist();
            this.defaultBlacklistDurationMs = config.getDefaultBlacklistDurationMs();
            this.requestRetentionMs = config.getRequestRetentionMs();
            this.backoffBaseMs = progressive.getBaseMs();
            this.backoffMaxMs = progressive.getMaxMs();
            return this;
        }

        /**
         * @throws IllegalArgumentException if a duration is not positive
         */
        public RateLimiter build() {
            if (defaultBlacklistDurationMs <= 0) {
                throw new IllegalArgumentException(
                        "defaultBlacklistDurationMs must be > 0, got: " + defaultBlacklistDurationMs);
            }
            if (requestRetentionMs <= 0) {
                throw new IllegalArgumentException(
                        "requestRetentionMs must be > 0, got: " + requestRetentionMs);
            }
            if (backoffBaseMs <= 0 || backoffMaxMs < backoffBaseMs) {
                throw new IllegalArgumentException(
                        "backoff requires 0 < base <= max, got base=" + backoffBaseMs + ", max=" + backoffMaxMs);
            }
            return new RateLimiter(this);
        }
    }
}
