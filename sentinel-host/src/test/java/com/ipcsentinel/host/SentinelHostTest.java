package com.ipcsentinel.host;

import com.ipcsentinel.core.config.GuardConfig;
import com.ipcsentinel.core.exception.RateLimitExceededException;
import com.ipcsentinel.core.mediator.CallerContext;
import com.ipcsentinel.core.mediator.HandlerOptions;
import com.ipcsentinel.core.model.Alert;
import com.ipcsentinel.core.model.AlertType;
import com.ipcsentinel.core.model.EventTypes;
import com.ipcsentinel.core.model.Severity;
import com.ipcsentinel.core.sender.SenderFrame;
import com.ipcsentinel.core.time.ManualTimeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SentinelHost} wiring and lifecycle.
 */
class SentinelHostTest {

    private ManualTimeSource clock;
    private List<Alert> alerts;
    private SentinelHost host;

    @BeforeEach
    void setUp() {
        clock = new ManualTimeSource(1_700_000_000_000L);
        alerts = new CopyOnWriteArrayList<>();
        host = SentinelHost.builder(HostConfig.builder().statsEnabled(false).build())
                .guardConfig(GuardConfig.defaults())
                .timeSource(clock)
                .alertSink(alerts::add)
                .build();
    }

    @AfterEach
    void tearDown() {
        host.close();
    }

    @Test
    @DisplayName("Should wire mediator, limiter and monitor from one configuration")
    void shouldWireComponents() {
        assertThat(host.getMediator().getRateLimiter()).isSameAs(host.getRateLimiter());
        assertThat(host.getMediator().getSecurityMonitor()).isSameAs(host.getSecurityMonitor());
        assertThat(host.getSecurityMonitor().getThresholds()).hasSize(4);
        assertThat(host.getSecurityMonitor().getPatterns()).hasSize(4);
    }

    @Test
    @DisplayName("Should raise a threshold alert after ten rate-limit rejections")
    void shouldAlertOnRepeatedRateLimiting() {
        host.getMediator().handle("task:create", HandlerOptions.builder().rateLimit(1, 60_000).build(),
                (ctx, args) -> "ok");
        CallerContext caller = new CallerContext("w1", SenderFrame.topLevel("app://bundle/"));
        host.getMediator().execute("task:create", caller);

        for (int i = 0; i < 10; i++) {
            clock.advance(i % 2 == 0 ? 50 : 400);
            assertThatThrownBy(() -> host.getMediator().execute("task:create", caller))
                    .isInstanceOf(RateLimitExceededException.class);
        }

        assertThat(alerts)
                .filteredOn(alert -> alert.getType() == AlertType.THRESHOLD_EXCEEDED)
                .singleElement()
                .satisfies(alert -> {
                    assertThat(alert.getEventType()).isEqualTo(EventTypes.RATE_LIMIT_EXCEEDED);
                    assertThat(alert.getCount()).isEqualTo(10);
                });
    }

    @Test
    @DisplayName("Should prune monitor and limiter state on cleanup but keep registrations")
    void shouldRunCleanup() {
        host.getMediator().handle("ping", HandlerOptions.none(), (ctx, args) -> "pong");
        host.getSecurityMonitor().logSecurityEvent(EventTypes.INVALID_INPUT, Severity.LOW, Map.of());
        clock.advance(86_400_000);

        host.runCleanup();

        assertThat(host.getSecurityMonitor().getRecentEvents()).isEmpty();
        assertThat(host.getMediator().isRegistered("ping")).isTrue();
    }

    @Test
    @DisplayName("Should refuse to start twice or after close")
    void shouldGuardLifecycle() {
        host.start();
        assertThat(host.isStarted()).isTrue();
        assertThatThrownBy(host::start).isInstanceOf(IllegalStateException.class);

        host.close();
        assertThat(host.isStarted()).isFalse();
        assertThatThrownBy(host::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should leave a caller-supplied scheduler running after close")
    void shouldNotShutDownInjectedScheduler() {
        ScheduledExecutorService shared = Executors.newSingleThreadScheduledExecutor();
        try {
            SentinelHost borrowing = SentinelHost.builder(HostConfig.builder().statsEnabled(false).build())
                    .guardConfig(GuardConfig.defaults())
                    .timeSource(clock)
                    .alertSink(alerts::add)
                    .scheduler(shared)
                    .build();
            borrowing.start();
            borrowing.getRateLimiter().blacklistSender("w1", 60_000);

            borrowing.close();

            assertThat(shared.isShutdown()).isFalse();
            assertThat(borrowing.getRateLimiter().isBlacklisted("w1")).isFalse();
        } finally {
            shared.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should serve mediator stats and metrics when enabled")
    void shouldServeStats() throws Exception {
        SentinelHost served = SentinelHost.builder(HostConfig.builder().statsPort(0).build())
                .guardConfig(GuardConfig.defaults())
                .timeSource(clock)
                .alertSink(alerts::add)
                .build();
        try {
            served.getMediator().handle("ping", HandlerOptions.none(), (ctx, args) -> "pong");
            served.getSecurityMonitor().logSecurityEvent(EventTypes.AUTH_FAILURE, Severity.HIGH,
                    Map.of("channel", "admin:reset"));
            served.start();

            HttpRequest request = HttpRequest.newBuilder(
                    URI.create("http://localhost:" + served.getStatsServer().getPort() + "/stats")).GET().build();
            HttpResponse<String> response = HttpClient.newHttpClient()
                    .send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body())
                    .contains("\"registeredHandlerCount\":1")
                    .contains("\"type\":\"auth_failure\"")
                    .contains("\"severity\":\"high\"")
                    .contains("\"totalEvents\":1");
        } finally {
            served.close();
        }
        assertThat(served.getStatsServer().isRunning()).isFalse();
    }
}
