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
import com.ipcsentinel.core.sender.SenderValidationResult;
import com.ipcsentinel.core.sender.SenderValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Gatekeeper between untrusted IPC callers and privileged handlers.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   execute(channel, context, args)
 *     → sender validation      (unauthorized_sender, HIGH)
 *     → rate limit / blacklist (rate_limit_exceeded, MEDIUM)
 *     → input validation       (invalid_input, MEDIUM)
 *     → input sanitization     (invalid_input, MEDIUM)
 *     → authentication         (auth_failure, HIGH)
 *     → handler                (handler_error, LOW)
 * </pre>
 *
 * <p>
 * Each step fails fast: the event in parentheses is logged to the
 * {@link SecurityMonitor} and a typed
 * {@link com.ipcsentinel.core.exception.IpcSecurityException} is thrown.
 * Handler exceptions are logged and rethrown unchanged when unchecked, or
 * wrapped in {@link HandlerException} when checked. Validators, sanitizers
 * and handlers may answer with a {@link CompletionStage}; it is awaited and
 * a failed stage is treated like a synchronous throw. No step is retried.
 * </p>
 *
 * <h3>Registration</h3>
 * <p>
 * Channels starting with a reserved framework prefix are refused with a
 * {@link ConfigurationException}, as is {@code requireAuth} without an
 * {@link Authenticator}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Registration and execution may run concurrently. Shared state lives in the
 * rate limiter and the monitor, both thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class IpcMediator {

    private static final Logger LOG = LoggerFactory.getLogger(IpcMediator.class);

    /** Number of events included in {@link #getStats()}. */
    public static final int STATS_EVENT_COUNT = 100;

    private static final int MAX_LOGGED_INPUT_LENGTH = 256;

    private final RateLimiter rateLimiter;
    private final SecurityMonitor securityMonitor;
    private final Authenticator authenticator;
    private final List<String> reservedPrefixes;
    private final boolean progressiveBlacklist;

    private final Map<String, HandlerRegistration> registrations = new ConcurrentHashMap<>();

    private IpcMediator(Builder b) {
        this.rateLimiter = Objects.requireNonNull(b.rateLimiter, "rateLimiter must not be null");
        this.securityMonitor = Objects.requireNonNull(b.securityMonitor, "securityMonitor must not be null");
        this.authenticator = b.authenticator;
        this.reservedPrefixes = List.copyOf(b.reservedPrefixes);
        this.progressiveBlacklist = b.progressiveBlacklist;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Bind a handler to a channel. Registering the same channel again
     * replaces the earlier registration, including its rate limit.
     *
     * @throws ConfigurationException if the channel is blank or reserved, or
     *                                authentication is required but no
     *                                authenticator is configured
     */
    public void handle(String channel, HandlerOptions options, IpcHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        HandlerOptions effective = options != null ? options : HandlerOptions.none();

        if (channel == null || channel.isBlank()) {
            throw new ConfigurationException(channel, "Channel name must not be blank");
        }
        for (String prefix : reservedPrefixes) {
            if (channel.startsWith(prefix)) {
                throw new ConfigurationException(channel,
                        "Cannot register handler for internal channel '" + channel + "'");
            }
        }
        if (effective.isRequireAuth() && authenticator == null) {
            throw new ConfigurationException(channel,
                    "Channel '" + channel + "' requires authentication but no authenticator is configured");
        }

        HandlerRegistration previous = registrations.put(channel,
                new HandlerRegistration(channel, effective, handler));
        if (previous != null) {
            LOG.warn("Handler for channel '{}' replaced", channel);
        }

        if (effective.hasRateLimit()) {
            rateLimiter.setLimit(channel, effective.getMaxRequests(), effective.getWindowMs());
        } else if (previous != null && previous.getOptions().hasRateLimit()) {
            rateLimiter.removeLimit(channel);
        }
        LOG.info("Registered handler for channel '{}' with {}", channel, effective);
    }

    /**
     * @return {@code true} if a handler is bound to the channel
     */
    public boolean isRegistered(String channel) {
        return channel != null && registrations.containsKey(channel);
    }

    /**
     * @return registered channel names, sorted
     */
    public Set<String> getRegisteredChannels() {
        return Collections.unmodifiableSet(new TreeSet<>(registrations.keySet()));
    }

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------

    /**
     * Run a call through the pipeline and return the handler's result.
     *
     * @param channel channel name
     * @param context caller metadata
     * @param args    call arguments; the first one is validated and sanitized
     * @return the handler's result, awaited if it is a {@link CompletionStage}
     * @throws ChannelNotRegisteredException    if no handler is bound
     * @throws UnauthorizedSenderException      if sender validation fails
     * @throws RateLimitExceededException       if the call is over the limit
     * @throws InvalidInputException            if validation or sanitization
     *                                          rejects the first argument
     * @throws AuthenticationRequiredException  if authentication fails
     * @throws HandlerException                 if the handler throws a checked
     *                                          exception
     */
    public Object execute(String channel, CallerContext context, Object... args) {
        Objects.requireNonNull(context, "CallerContext must not be null");
        HandlerRegistration registration = channel != null ? registrations.get(channel) : null;
        if (registration == null) {
            throw new ChannelNotRegisteredException(channel, "No handler registered for channel: " + channel);
        }

        HandlerOptions options = registration.getOptions();
        String senderId = context.getSenderId();
        List<Object> callArgs = args != null ? new ArrayList<>(Arrays.asList(args)) : new ArrayList<>();

        // 1. Sender
        SenderValidationResult sender = SenderValidator.validateSender(context.getFrame(), options.getAllowedOrigins());
        if (!sender.isValid()) {
            String reason = sender.getReason().orElse("unauthorized sender");
            securityMonitor.logSecurityEvent(EventTypes.UNAUTHORIZED_SENDER, Severity.HIGH, details(
                    SecurityEvent.DETAIL_CHANNEL, channel,
                    "reason", reason,
                    "origin", sender.getOrigin().orElse(null),
                    "frameId", sender.getFrameId().orElse(null),
                    SecurityEvent.DETAIL_SENDER_ID, senderId));
            throw new UnauthorizedSenderException(channel, reason);
        }

        // 2. Rate limit
        if (!rateLimiter.checkLimit(channel, senderId)) {
            securityMonitor.logSecurityEvent(EventTypes.RATE_LIMIT_EXCEEDED, Severity.MEDIUM, details(
                    SecurityEvent.DETAIL_CHANNEL, channel,
                    SecurityEvent.DETAIL_SENDER_ID, senderId));
            if (progressiveBlacklist) {
                long banned = rateLimiter.recordViolation(senderId);
                LOG.debug("Sender {} blacklisted for {} ms after repeated violations", senderId, banned);
            }
            throw new RateLimitExceededException(channel, "Rate limit exceeded");
        }

        // 3. Validation
        if (options.hasValidator() && !callArgs.isEmpty()) {
            Object input = callArgs.get(0);
            boolean accepted;
            Exception failure = null;
            try {
                accepted = validate(options, input);
            } catch (Exception e) {
                accepted = false;
                failure = e;
            }
            if (!accepted) {
                logInvalidInput(channel, senderId, input, failure != null ? failure.getMessage() : null);
                throw new InvalidInputException(channel, "Invalid input", failure);
            }
        }

        // 4. Sanitization
        if (options.getSanitizer() != null && !callArgs.isEmpty()) {
            Object input = callArgs.get(0);
            try {
                Object sanitized = options.getSanitizer().apply(input);
                if (sanitized instanceof CompletionStage<?> stage) {
                    sanitized = await(stage);
                }
                callArgs.set(0, sanitized);
            } catch (Exception e) {
                logInvalidInput(channel, senderId, input, e.getMessage());
                throw new InvalidInputException(channel,
                        e.getMessage() != null ? e.getMessage() : "Input rejected by sanitizer", e);
            }
        }

        // 5. Authentication
        if (options.isRequireAuth() && !authenticator.isAuthenticated(context)) {
            securityMonitor.logSecurityEvent(EventTypes.AUTH_FAILURE, Severity.HIGH, details(
                    SecurityEvent.DETAIL_CHANNEL, channel,
                    SecurityEvent.DETAIL_SENDER_ID, senderId));
            throw new AuthenticationRequiredException(channel, "Authentication required");
        }

        // 6. Handler
        try {
            Object result = registration.getHandler().handle(context, Collections.unmodifiableList(callArgs));
            if (result instanceof CompletionStage<?> stage) {
                result = await(stage);
            }
            return result;
        } catch (RuntimeException | Error e) {
            logHandlerError(channel, senderId, e);
            throw e;
        } catch (Exception e) {
            logHandlerError(channel, senderId, e);
            throw new HandlerException(channel, e);
        }
    }

    /**
     * Run {@link #execute} on {@code executor}. Every failure, from any
     * step, completes the returned future exceptionally with the same
     * exception {@code execute} would have thrown (wrapped in a
     * {@link CompletionException} by {@code join()}).
     */
    public CompletableFuture<Object> executeAsync(String channel, CallerContext context, Executor executor,
            Object... args) {
        Objects.requireNonNull(executor, "executor must not be null");
        return CompletableFuture.supplyAsync(() -> execute(channel, context, args), executor);
    }

    // ---------------------------------------------------------------
    // Stats / maintenance
    // ---------------------------------------------------------------

    /**
     * @return handler count, limiter counters and the last
     *         {@value #STATS_EVENT_COUNT} security events
     */
    public MediatorStats getStats() {
        return new MediatorStats(registrations.size(), rateLimiter.getStats(),
                securityMonitor.getRecentEvents(STATS_EVENT_COUNT));
    }

    /**
     * Drop every registration together with the rate rules it installed, and
     * prune the rate limiter's logs.
     */
    public void cleanup() {
        int count = registrations.size();
        for (String channel : List.copyOf(registrations.keySet())) {
            HandlerRegistration removed = registrations.remove(channel);
            if (removed != null && removed.getOptions().hasRateLimit()) {
                rateLimiter.removeLimit(channel);
            }
        }
        rateLimiter.cleanup();
        LOG.info("Mediator cleanup: {} registration(s) cleared", count);
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public SecurityMonitor getSecurityMonitor() {
        return securityMonitor;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void logInvalidInput(String channel, String senderId, Object input, String reason) {
        securityMonitor.logSecurityEvent(EventTypes.INVALID_INPUT, Severity.MEDIUM, details(
                SecurityEvent.DETAIL_CHANNEL, channel,
                SecurityEvent.DETAIL_SENDER_ID, senderId,
                "input", abbreviate(String.valueOf(input)),
                "reason", reason));
    }

    private void logHandlerError(String channel, String senderId, Throwable e) {
        securityMonitor.logSecurityEvent(EventTypes.HANDLER_ERROR, Severity.LOW, details(
                SecurityEvent.DETAIL_CHANNEL, channel,
                SecurityEvent.DETAIL_SENDER_ID, senderId,
                "error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
    }

    private static boolean validate(HandlerOptions options, Object input) throws Exception {
        if (options.getValidator() != null) {
            return options.getValidator().test(input);
        }
        CompletionStage<Boolean> verdict = options.getAsyncValidator().apply(input);
        return verdict != null && Boolean.TRUE.equals(await(verdict));
    }

    private static Object await(CompletionStage<?> stage) throws Exception {
        try {
            return stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    /** Builds a details map from key/value pairs, skipping null values. */
    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }

    private static String abbreviate(String value) {
        return value.length() <= MAX_LOGGED_INPUT_LENGTH
                ? value
                : value.substring(0, MAX_LOGGED_INPUT_LENGTH) + "...";
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link IpcMediator}. The rate limiter and the
     * security monitor are required.
     */
    public static class Builder {
        private RateLimiter rateLimiter;
        private SecurityMonitor securityMonitor;
        private Authenticator authenticator;
        private List<String> reservedPrefixes = GuardConfig.DEFAULT_RESERVED_PREFIXES;
        private boolean progressiveBlacklist;

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder securityMonitor(SecurityMonitor securityMonitor) {
            this.securityMonitor = securityMonitor;
            return this;
        }

        public Builder authenticator(Authenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        public Builder reservedPrefixes(List<String> reservedPrefixes) {
            this.reservedPrefixes = Objects.requireNonNull(reservedPrefixes, "reservedPrefixes must not be null");
            return this;
        }

        /**
         * Blacklist repeat rate-limit offenders with a growing duration.
         */
        public Builder progressiveBlacklist(boolean enabled) {
            this.progressiveBlacklist = enabled;
            return this;
        }

        /**
         * Take reserved prefixes and the progressive-blacklist switch from a
         * configuration.
         */
        public Builder config(GuardConfig config) {
            Objects.requireNonNull(config, "GuardConfig must not be null");
            this.reservedPrefixes = config.getReservedChannelPrefixes();
            this.progressiveBlacklist = config.getProgressiveBlacklist().isEnabled();
            return this;
        }

        public IpcMediator build() {
            return new IpcMediator(this);
        }
    }
}
