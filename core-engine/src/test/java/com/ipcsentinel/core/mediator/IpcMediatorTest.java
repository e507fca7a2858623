package com.ipcsentinel.core.mediator;

import com.ipcsentinel.core.config.GuardConfig;
import com.ipcsentinel.core.exception.AuthenticationRequiredException;
import com.ipcsentinel.core.exception.ChannelNotRegisteredException;
import com.ipcsentinel.core.exception.ConfigurationException;
import com.ipcsentinel.core.exception.HandlerException;
import com.ipcsentinel.core.exception.InvalidInputException;
import com.ipcsentinel.core.exception.RateLimitExceededException;
import com.ipcsentinel.core.exception.UnauthorizedSenderException;
import com.ipcsentinel.core.model.EventTypes;
import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.model.Severity;
import com.ipcsentinel.core.monitor.SecurityMonitor;
import com.ipcsentinel.core.ratelimit.RateLimiter;
import com.ipcsentinel.core.sender.SenderFrame;
import com.ipcsentinel.core.sender.SenderValidator;
import com.ipcsentinel.core.time.ManualTimeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IpcMediator}.
 */
class IpcMediatorTest {

    private static final String APP_ORIGIN = "app://bundle";

    private ManualTimeSource clock;
    private RateLimiter rateLimiter;
    private SecurityMonitor monitor;
    private IpcMediator mediator;
    private CallerContext caller;

    @BeforeEach
    void setUp() {
        clock = new ManualTimeSource(1_700_000_000_000L);
        rateLimiter = RateLimiter.builder().timeSource(clock).build();
        monitor = SecurityMonitor.builder()
                .timeSource(clock)
                .alertSink(alert -> { })
                .config(GuardConfig.defaults())
                .build();
        mediator = IpcMediator.builder()
                .rateLimiter(rateLimiter)
                .securityMonitor(monitor)
                .authenticator(ctx -> "admin".equals(ctx.getSenderId()))
                .build();
        caller = new CallerContext("window-1", SenderFrame.topLevel(APP_ORIGIN + "/index.html"));
    }

    @AfterEach
    void tearDown() {
        rateLimiter.close();
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should refuse reserved framework channels and never dispatch them")
    void shouldRefuseReservedChannel() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> mediator.handle("ELECTRON_BROWSER_REQUIRE", HandlerOptions.none(),
                (ctx, args) -> calls.incrementAndGet()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("internal channel");

        assertThat(mediator.isRegistered("ELECTRON_BROWSER_REQUIRE")).isFalse();
        assertThatThrownBy(() -> mediator.execute("ELECTRON_BROWSER_REQUIRE", caller))
                .isInstanceOf(ChannelNotRegisteredException.class);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("Should refuse blank channels and requireAuth without an authenticator")
    void shouldRefuseInvalidRegistrations() {
        IpcMediator noAuth = IpcMediator.builder().rateLimiter(rateLimiter).securityMonitor(monitor).build();

        assertThatThrownBy(() -> mediator.handle(" ", HandlerOptions.none(), (ctx, args) -> null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> noAuth.handle("admin:op",
                HandlerOptions.builder().requireAuth(true).build(), (ctx, args) -> null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no authenticator");
    }

    @Test
    @DisplayName("Should replace an existing registration")
    void shouldReplaceRegistration() {
        mediator.handle("ping", HandlerOptions.none(), (ctx, args) -> "v1");
        mediator.handle("ping", null, (ctx, args) -> "v2");

        assertThat(mediator.execute("ping", caller)).isEqualTo("v2");
        assertThat(mediator.getRegisteredChannels()).containsExactly("ping");
    }

    @Test
    @DisplayName("Should drop the earlier rate limit when a channel is re-registered without one")
    void shouldDropRateLimitOnReRegistration() {
        mediator.handle("ping", HandlerOptions.builder().rateLimit(1, 60_000).build(), (ctx, args) -> "v1");
        mediator.execute("ping", caller);

        mediator.handle("ping", HandlerOptions.none(), (ctx, args) -> "v2");

        assertThat(rateLimiter.getRule("ping")).isNull();
        assertThat(mediator.execute("ping", caller)).isEqualTo("v2");
        assertThat(mediator.execute("ping", caller)).isEqualTo("v2");
    }

    @Test
    @DisplayName("Should reject calls to unregistered channels")
    void shouldRejectUnknownChannel() {
        assertThatThrownBy(() -> mediator.execute("nope", caller))
                .isInstanceOf(ChannelNotRegisteredException.class)
                .hasMessageContaining("nope");
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should pass two calls and reject the third with one rate_limit_exceeded event")
    void shouldRateLimitEndToEnd() {
        mediator.handle("task:create",
                HandlerOptions.builder().rateLimit(2, 1000).build(),
                (ctx, args) -> "created:" + args.get(0));

        assertThat(mediator.execute("task:create", caller, "a")).isEqualTo("created:a");
        assertThat(mediator.execute("task:create", caller, "b")).isEqualTo("created:b");
        assertThat(monitor.getRecentEvents()).isEmpty();

        assertThatThrownBy(() -> mediator.execute("task:create", caller, "c"))
                .isInstanceOf(RateLimitExceededException.class)
                .hasMessage("Rate limit exceeded");

        List<SecurityEvent> events = monitor.getRecentEvents();
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getType()).isEqualTo(EventTypes.RATE_LIMIT_EXCEEDED);
        assertThat(events.get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(events.get(0).getDetails())
                .containsEntry(SecurityEvent.DETAIL_CHANNEL, "task:create")
                .containsEntry(SecurityEvent.DETAIL_SENDER_ID, "window-1");

        clock.advance(1000);
        assertThat(mediator.execute("task:create", caller, "d")).isEqualTo("created:d");
    }

    @Test
    @DisplayName("Should reject iframe callers with an unauthorized_sender event")
    void shouldRejectIframeSender() {
        mediator.handle("file:read", HandlerOptions.none(), (ctx, args) -> "data");
        CallerContext framed = new CallerContext("window-1", new SenderFrame(APP_ORIGIN + "/x", true, 3));

        assertThatThrownBy(() -> mediator.execute("file:read", framed))
                .isInstanceOf(UnauthorizedSenderException.class)
                .hasMessage(SenderValidator.REASON_IFRAME);

        SecurityEvent event = monitor.getRecentEvents().get(0);
        assertThat(event.getType()).isEqualTo(EventTypes.UNAUTHORIZED_SENDER);
        assertThat(event.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(event.getDetails())
                .containsEntry("reason", SenderValidator.REASON_IFRAME)
                .containsEntry("origin", APP_ORIGIN)
                .containsEntry("frameId", 3);
    }

    @Test
    @DisplayName("Should reject origins outside the allow-list and callers without a frame")
    void shouldRejectUnlistedOrigin() {
        mediator.handle("file:read", HandlerOptions.builder().allowedOrigins(APP_ORIGIN).build(),
                (ctx, args) -> "data");

        assertThat(mediator.execute("file:read", caller)).isEqualTo("data");
        assertThatThrownBy(() -> mediator.execute("file:read",
                new CallerContext("w2", SenderFrame.topLevel("https://evil.example.com/"))))
                .isInstanceOf(UnauthorizedSenderException.class)
                .hasMessage(SenderValidator.REASON_ORIGIN);
        assertThatThrownBy(() -> mediator.execute("file:read", new CallerContext("w3", null)))
                .isInstanceOf(UnauthorizedSenderException.class)
                .hasMessage(SenderValidator.REASON_NO_FRAME);
        assertThat(monitor.getEventsByType(EventTypes.UNAUTHORIZED_SENDER)).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a blacklisted sender before the validator runs")
    void shouldRejectBlacklistedSender() {
        AtomicInteger validated = new AtomicInteger();
        mediator.handle("ping", HandlerOptions.builder()
                .validator(arg -> validated.incrementAndGet() > 0)
                .build(), (ctx, args) -> "pong");
        rateLimiter.blacklistSender("window-1", 10_000);

        assertThatThrownBy(() -> mediator.execute("ping", caller, "x"))
                .isInstanceOf(RateLimitExceededException.class);
        assertThat(validated).hasValue(0);
    }

    @Test
    @DisplayName("Should blacklist repeat offenders when progressive blacklisting is on")
    void shouldBlacklistProgressively() {
        IpcMediator progressive = IpcMediator.builder()
                .rateLimiter(rateLimiter)
                .securityMonitor(monitor)
                .progressiveBlacklist(true)
                .build();
        progressive.handle("burst", HandlerOptions.builder().rateLimit(1, 60_000).build(), (ctx, args) -> "ok");

        progressive.execute("burst", caller);
        assertThatThrownBy(() -> progressive.execute("burst", caller))
                .isInstanceOf(RateLimitExceededException.class);

        assertThat(rateLimiter.isBlacklisted("window-1")).isTrue();
        assertThat(rateLimiter.getViolationCount("window-1")).isEqualTo(1);
        clock.advance(1_000);
        assertThat(rateLimiter.isBlacklisted("window-1")).isFalse();
    }

    @Test
    @DisplayName("Should reject input the validator refuses, without calling the handler")
    void shouldRejectInvalidInput() {
        AtomicInteger calls = new AtomicInteger();
        mediator.handle("user:rename", HandlerOptions.builder()
                .validator(arg -> arg instanceof String s && !s.isBlank())
                .build(), (ctx, args) -> calls.incrementAndGet());

        assertThatThrownBy(() -> mediator.execute("user:rename", caller, 42))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid input");

        SecurityEvent event = monitor.getRecentEvents().get(0);
        assertThat(event.getType()).isEqualTo(EventTypes.INVALID_INPUT);
        assertThat(event.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(event.getDetails()).containsEntry("input", "42");
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("Should treat a throwing validator as a rejection")
    void shouldTreatThrowingValidatorAsInvalid() {
        mediator.handle("ping", HandlerOptions.builder()
                .validator(arg -> {
                    throw new IllegalArgumentException("boom");
                })
                .build(), (ctx, args) -> "pong");

        assertThatThrownBy(() -> mediator.execute("ping", caller, "x"))
                .isInstanceOf(InvalidInputException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should await an asynchronous validator and reject on false or failure")
    void shouldAwaitAsyncValidator() {
        AtomicInteger calls = new AtomicInteger();
        mediator.handle("ping", HandlerOptions.builder()
                .asyncValidator(arg -> CompletableFuture.supplyAsync(() -> "ok".equals(arg)))
                .build(), (ctx, args) -> calls.incrementAndGet());
        mediator.handle("pong", HandlerOptions.builder()
                .asyncValidator(arg -> CompletableFuture.failedFuture(new IOException("schema service down")))
                .build(), (ctx, args) -> calls.incrementAndGet());

        assertThat(mediator.execute("ping", caller, "ok")).isEqualTo(1);
        assertThatThrownBy(() -> mediator.execute("ping", caller, "nope"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid input");
        assertThatThrownBy(() -> mediator.execute("pong", caller, "ok"))
                .isInstanceOf(InvalidInputException.class)
                .hasCauseInstanceOf(IOException.class);

        assertThat(calls).hasValue(1);
        assertThat(monitor.getEventsByType(EventTypes.INVALID_INPUT)).hasSize(2);
    }

    @Test
    @DisplayName("Should hand the awaited value of an asynchronous sanitizer to the handler")
    void shouldAwaitAsyncSanitizer() {
        mediator.handle("file:read", HandlerOptions.builder()
                .sanitizer(arg -> CompletableFuture.supplyAsync(() -> "clean"))
                .build(), (ctx, args) -> args.get(0));

        assertThat(mediator.execute("file:read", caller, "dirty")).isEqualTo("clean");
    }

    @Test
    @DisplayName("Should treat a failed asynchronous sanitizer like a synchronous rejection")
    void shouldRejectOnFailedAsyncSanitizer() {
        AtomicInteger calls = new AtomicInteger();
        mediator.handle("file:read", HandlerOptions.builder()
                .sanitizer(arg -> CompletableFuture.failedFuture(new IllegalArgumentException("Null byte detected")))
                .build(), (ctx, args) -> calls.incrementAndGet());

        assertThatThrownBy(() -> mediator.execute("file:read", caller, "dirty"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Null byte detected")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(calls).hasValue(0);
        assertThat(monitor.getEventsByType(EventTypes.INVALID_INPUT))
                .singleElement()
                .satisfies(event -> assertThat(event.getDetails()).containsEntry("reason", "Null byte detected"));
    }

    @Test
    @DisplayName("Should hand the sanitized argument to the handler and keep the rest")
    void shouldSanitizeFirstArgument() {
        List<Object> received = new ArrayList<>();
        mediator.handle("file:read", HandlerOptions.builder().sanitizer(InputSanitizers.PATH).build(),
                (ctx, args) -> {
                    received.addAll(args);
                    return "ok";
                });

        mediator.execute("file:read", caller, "docs\\\\a//b.txt", "utf-8");

        assertThat(received).containsExactly("docs/a/b.txt", "utf-8");
    }

    @Test
    @DisplayName("Should log invalid_input when the sanitizer rejects the argument")
    void shouldRejectUnsafeInput() {
        mediator.handle("file:read", HandlerOptions.builder().sanitizer(InputSanitizers.PATH).build(),
                (ctx, args) -> "ok");

        assertThatThrownBy(() -> mediator.execute("file:read", caller, "../../etc/passwd"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Path traversal detected");
        assertThat(monitor.getEventsByType(EventTypes.INVALID_INPUT)).hasSize(1);
    }

    @Test
    @DisplayName("Should require authentication when configured")
    void shouldRequireAuthentication() {
        mediator.handle("admin:reset", HandlerOptions.builder().requireAuth(true).build(), (ctx, args) -> "done");

        assertThatThrownBy(() -> mediator.execute("admin:reset", caller))
                .isInstanceOf(AuthenticationRequiredException.class)
                .hasMessage("Authentication required");
        assertThat(monitor.getEventsByType(EventTypes.AUTH_FAILURE))
                .singleElement()
                .extracting(SecurityEvent::getSeverity)
                .isEqualTo(Severity.HIGH);

        CallerContext admin = new CallerContext("admin", SenderFrame.topLevel(APP_ORIGIN + "/"));
        assertThat(mediator.execute("admin:reset", admin)).isEqualTo("done");
    }

    // ---------------------------------------------------------------
    // Handler failures and async results
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should rethrow unchecked handler exceptions unchanged and log handler_error")
    void shouldRethrowUncheckedHandlerException() {
        IllegalStateException failure = new IllegalStateException("disk full");
        mediator.handle("file:write", HandlerOptions.none(), (ctx, args) -> {
            throw failure;
        });

        assertThatThrownBy(() -> mediator.execute("file:write", caller)).isSameAs(failure);

        SecurityEvent event = monitor.getRecentEvents().get(0);
        assertThat(event.getType()).isEqualTo(EventTypes.HANDLER_ERROR);
        assertThat(event.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(event.getDetails()).containsEntry("error", "disk full");
    }

    @Test
    @DisplayName("Should log handler_error for a handler that throws an Error and rethrow it")
    void shouldLogErrorThrownByHandler() {
        AssertionError failure = new AssertionError("invariant broken");
        mediator.handle("file:write", HandlerOptions.none(), (ctx, args) -> {
            throw failure;
        });

        assertThatThrownBy(() -> mediator.execute("file:write", caller)).isSameAs(failure);

        assertThat(monitor.getEventsByType(EventTypes.HANDLER_ERROR))
                .singleElement()
                .satisfies(event -> assertThat(event.getDetails()).containsEntry("error", "invariant broken"));
    }

    @Test
    @DisplayName("Should wrap checked handler exceptions in HandlerException")
    void shouldWrapCheckedHandlerException() {
        mediator.handle("file:write", HandlerOptions.none(), (ctx, args) -> {
            throw new IOException("read-only");
        });

        assertThatThrownBy(() -> mediator.execute("file:write", caller))
                .isInstanceOf(HandlerException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining("read-only");
    }

    @Test
    @DisplayName("Should await asynchronous handler results")
    void shouldAwaitCompletionStage() {
        mediator.handle("async:ok", HandlerOptions.none(),
                (ctx, args) -> CompletableFuture.completedFuture("later"));
        mediator.handle("async:fail", HandlerOptions.none(),
                (ctx, args) -> CompletableFuture.failedFuture(new IOException("remote down")));

        assertThat(mediator.execute("async:ok", caller)).isEqualTo("later");
        assertThatThrownBy(() -> mediator.execute("async:fail", caller))
                .isInstanceOf(HandlerException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should run the pipeline on the given executor")
    void shouldExecuteAsync() {
        mediator.handle("ping", HandlerOptions.none(), (ctx, args) -> "pong");

        assertThat(mediator.executeAsync("ping", caller, Runnable::run).join()).isEqualTo("pong");
        assertThatThrownBy(() -> mediator.executeAsync("missing", caller, Runnable::run).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ChannelNotRegisteredException.class);
    }

    // ---------------------------------------------------------------
    // Stats / maintenance
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should report handler count, limiter stats and recent events")
    void shouldReportStats() {
        mediator.handle("a", HandlerOptions.builder().rateLimit(5, 1000).build(), (ctx, args) -> null);
        mediator.handle("b", HandlerOptions.none(), (ctx, args) -> null);
        mediator.execute("a", caller);
        rateLimiter.blacklistSender("evil", 1000);

        MediatorStats stats = mediator.getStats();

        assertThat(stats.getRegisteredHandlerCount()).isEqualTo(2);
        assertThat(stats.getRateLimiterStats().getTotalRequests()).isEqualTo(1);
        assertThat(stats.getRateLimiterStats().getBlacklistedSenders()).isEqualTo(1);
        assertThat(stats.getRecentSecurityEvents()).isEmpty();
    }

    @Test
    @DisplayName("Should clear every registration on cleanup")
    void shouldClearOnCleanup() {
        mediator.handle("a", HandlerOptions.none(), (ctx, args) -> null);
        mediator.handle("b", HandlerOptions.builder().rateLimit(1, 60_000).build(), (ctx, args) -> "v1");
        mediator.execute("b", caller);

        mediator.cleanup();

        assertThat(mediator.getRegisteredChannels()).isEmpty();
        assertThat(mediator.getStats().getRegisteredHandlerCount()).isZero();
        assertThat(rateLimiter.getRule("b")).isNull();

        mediator.handle("b", HandlerOptions.none(), (ctx, args) -> "v2");
        assertThat(mediator.execute("b", caller)).isEqualTo("v2");
    }
}
