package com.ipcsentinel.host;

import com.ipcsentinel.core.config.GuardConfig;
import com.ipcsentinel.core.config.GuardConfigLoader;
import com.ipcsentinel.core.mediator.Authenticator;
import com.ipcsentinel.core.mediator.IpcMediator;
import com.ipcsentinel.core.monitor.AlertSink;
import com.ipcsentinel.core.monitor.SecurityMonitor;
import com.ipcsentinel.core.ratelimit.RateLimiter;
import com.ipcsentinel.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composition root: builds the rate limiter, security monitor and mediator
 * from one {@link GuardConfig} and runs them.
 *
 * <h3>Lifecycle</h3>
 *
 * <pre>
 *   HostConfig (env)
 *     → GuardConfig (GUARD_CONFIG_PATH or bundled defaults)
 *     → RateLimiter + SecurityMonitor (JsonAlertSink) + IpcMediator
 *     → start(): scheduled cleanup + /health, /stats
 *     → close(): cancel cleanup, stop server, cancel blacklist timers
 * </pre>
 *
 * <p>
 * Scheduled cleanup prunes the limiter's request logs and the monitor's
 * retained events. It leaves handler registrations alone.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelHost implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelHost.class);

    private final HostConfig config;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final RateLimiter rateLimiter;
    private final SecurityMonitor securityMonitor;
    private final IpcMediator mediator;
    private final StatsServer statsServer;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledFuture<?> cleanupTask;

    private SentinelHost(Builder b) {
        this.config = Objects.requireNonNull(b.hostConfig, "hostConfig must not be null");
        GuardConfig guard = b.guardConfig != null ? b.guardConfig : loadGuardConfig(config);
        guard.validate();
        this.ownsScheduler = b.scheduler == null;
        this.scheduler = ownsScheduler ? newScheduler() : b.scheduler;

        this.rateLimiter = RateLimiter.builder()
                .config(guard)
                .timeSource(b.timeSource)
                .scheduler(scheduler)
                .build();
        this.securityMonitor = SecurityMonitor.builder()
                .config(guard)
                .timeSource(b.timeSource)
                .alertSink(b.alertSink != null ? b.alertSink : new JsonAlertSink())
                .build();
        this.mediator = IpcMediator.builder()
                .config(guard)
                .rateLimiter(rateLimiter)
                .securityMonitor(securityMonitor)
                .authenticator(b.authenticator)
                .build();
        this.statsServer = new StatsServer(this::statsSnapshot);
    }

    public static Builder builder(HostConfig hostConfig) {
        return new Builder(hostConfig);
    }

    public static void main(String[] args) {
        HostConfig config = HostConfig.fromEnvironment();
        LOG.info("Starting IPC sentinel host with config: {}", config);

        SentinelHost host = builder(config).build();
        Runtime.getRuntime().addShutdownHook(new Thread(host::close, "sentinel-shutdown"));
        host.start();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Schedule cleanup and, if enabled, start the stats server.
     *
     * @throws IllegalStateException if already started or closed
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Host is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Host already started");
        }
        long interval = config.getCleanupIntervalMs();
        cleanupTask = scheduler.scheduleAtFixedRate(this::runCleanup, interval, interval, TimeUnit.MILLISECONDS);
        if (config.isStatsEnabled()) {
            statsServer.start(config.getStatsPort());
        }
        LOG.info("IPC sentinel host started (cleanup every {} ms)", interval);
    }

    /**
     * Prune rate-limiter logs and expired events. Called on the cleanup
     * cadence; safe to call directly.
     */
    public void runCleanup() {
        try {
            rateLimiter.cleanup();
            securityMonitor.cleanup();
        } catch (RuntimeException e) {
            // keep the schedule alive; scheduleAtFixedRate stops on a thrown exception
            LOG.error("Scheduled cleanup failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        statsServer.stop();
        rateLimiter.close();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        LOG.info("IPC sentinel host stopped");
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public IpcMediator getMediator() {
        return mediator;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public SecurityMonitor getSecurityMonitor() {
        return securityMonitor;
    }

    public StatsServer getStatsServer() {
        return statsServer;
    }

    public boolean isStarted() {
        return started.get() && !closed.get();
    }

    /**
     * @return the document served on {@code /stats}
     */
    Map<String, Object> statsSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("mediator", mediator.getStats());
        snapshot.put("metrics", securityMonitor.getMetrics());
        return snapshot;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static GuardConfig loadGuardConfig(HostConfig config) {
        if (config.hasGuardConfigPath()) {
            return GuardConfigLoader.fromFile(config.getGuardConfigPath());
        }
        return GuardConfigLoader.load();
    }

    private static ScheduledExecutorService newScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "sentinel-scheduler-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link SentinelHost}. Everything except the host
     * configuration is optional: the guard config is loaded per
     * {@link HostConfig}, time is the system clock, alerts go to a
     * {@link JsonAlertSink}, and a single-thread scheduler is created.
     */
    public static class Builder {
        private final HostConfig hostConfig;
        private GuardConfig guardConfig;
        private TimeSource timeSource = TimeSource.system();
        private AlertSink alertSink;
        private Authenticator authenticator;
        private ScheduledExecutorService scheduler;

        private Builder(HostConfig hostConfig) {
            this.hostConfig = hostConfig;
        }

        public Builder guardConfig(GuardConfig guardConfig) {
            this.guardConfig = guardConfig;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
            return this;
        }

        public Builder alertSink(AlertSink alertSink) {
            this.alertSink = alertSink;
            return this;
        }

        public Builder authenticator(Authenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        /**
         * Run timers on a caller-owned scheduler. {@link SentinelHost#close()}
         * cancels its own tasks but leaves the scheduler running.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public SentinelHost build() {
            return new SentinelHost(this);
        }
    }
}
