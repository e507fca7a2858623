package com.ipcsentinel.core.mediator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Per-channel security policy.
 *
 * <p>
 * Every field is optional:
 * </p>
 * <ul>
 * <li>{@code allowedOrigins} – origins the caller frame must come from;
 * empty means any</li>
 * <li>{@code requireAuth} – ask the mediator's {@link Authenticator}</li>
 * <li>{@code rateLimit} – sliding-window limit per sender</li>
 * <li>{@code validator} – predicate on the first argument, or an
 * {@code asyncValidator} whose stage completes with the verdict</li>
 * <li>{@code sanitizer} – replaces the first argument; may throw to
 * reject it. A {@link CompletionStage} result is awaited and its value
 * passed on.</li>
 * </ul>
 *
 * <p>
 * Built with {@link #builder()}; values are checked at {@link Builder#build()}
 * so a bad policy fails at registration, not at call time.
 * </p>
 *
 * @since 1.0.0
 */
public final class HandlerOptions {

    private static final HandlerOptions NONE = builder().build();

    private final List<String> allowedOrigins;
    private final boolean requireAuth;
    private final Integer maxRequests;
    private final Long windowMs;
    private final Predicate<Object> validator;
    private final Function<Object, ? extends CompletionStage<Boolean>> asyncValidator;
    private final UnaryOperator<Object> sanitizer;

    private HandlerOptions(Builder b) {
        this.allowedOrigins = Collections.unmodifiableList(new ArrayList<>(b.allowedOrigins));
        this.requireAuth = b.requireAuth;
        this.maxRequests = b.maxRequests;
        this.windowMs = b.windowMs;
        this.validator = b.validator;
        this.asyncValidator = b.asyncValidator;
        this.sanitizer = b.sanitizer;
    }

    /**
     * @return options with no restrictions beyond sender validation
     */
    public static HandlerOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public boolean isRequireAuth() {
        return requireAuth;
    }

    public boolean hasRateLimit() {
        return maxRequests != null;
    }

    /**
     * @return max requests per window, or {@code null} without a rate limit
     */
    public Integer getMaxRequests() {
        return maxRequests;
    }

    /**
     * @return window length, or {@code null} without a rate limit
     */
    public Long getWindowMs() {
        return windowMs;
    }

    public Predicate<Object> getValidator() {
        return validator;
    }

    public Function<Object, ? extends CompletionStage<Boolean>> getAsyncValidator() {
        return asyncValidator;
    }

    public boolean hasValidator() {
        return validator != null || asyncValidator != null;
    }

    public UnaryOperator<Object> getSanitizer() {
        return sanitizer;
    }

    @Override
    public String toString() {
        return "HandlerOptions{" +
                "allowedOrigins=" + allowedOrigins +
                ", requireAuth=" + requireAuth +
                (maxRequests != null ? ", rateLimit=[" + maxRequests + ", " + windowMs + "]" : "") +
                ", validator=" + hasValidator() +
                ", sanitizer=" + (sanitizer != null) +
                '}';
    }

    /**
     * Fluent builder for {@link HandlerOptions}.
     */
    public static class Builder {
        private final List<String> allowedOrigins = new ArrayList<>();
        private boolean requireAuth;
        private Integer maxRequests;
        private Long windowMs;
        private Predicate<Object> validator;
        private Function<Object, ? extends CompletionStage<Boolean>> asyncValidator;
        private UnaryOperator<Object> sanitizer;

        public Builder allowedOrigins(String... origins) {
            return allowedOrigins(List.of(origins));
        }

        public Builder allowedOrigins(List<String> origins) {
            this.allowedOrigins.clear();
            if (origins != null) {
                this.allowedOrigins.addAll(origins);
            }
            return this;
        }

        public Builder requireAuth(boolean requireAuth) {
            this.requireAuth = requireAuth;
            return this;
        }

        public Builder rateLimit(int maxRequests, long windowMs) {
            this.maxRequests = maxRequests;
            this.windowMs = windowMs;
            return this;
        }

        /**
         * Replaces any {@link #asyncValidator} set earlier.
         */
        public Builder validator(Predicate<Object> validator) {
            this.validator = validator;
            this.asyncValidator = null;
            return this;
        }

        /**
         * Validator that answers later. A stage completing with anything but
         * {@code true}, or completing exceptionally, rejects the input.
         * Replaces any {@link #validator} set earlier.
         */
        public Builder asyncValidator(Function<Object, ? extends CompletionStage<Boolean>> asyncValidator) {
            this.asyncValidator = asyncValidator;
            this.validator = null;
            return this;
        }

        public Builder sanitizer(UnaryOperator<Object> sanitizer) {
            this.sanitizer = sanitizer;
            return this;
        }

        /**
         * @throws IllegalArgumentException if an origin is blank or the rate
         *                                  limit is not positive
         */
        public HandlerOptions build() {
            for (String origin : allowedOrigins) {
                if (origin == null || origin.isBlank()) {
                    throw new IllegalArgumentException("allowedOrigins must not contain blank entries");
                }
            }
            if (maxRequests != null) {
                if (maxRequests <= 0) {
                    throw new IllegalArgumentException("rateLimit maxRequests must be > 0, got: " + maxRequests);
                }
                if (windowMs <= 0) {
                    throw new IllegalArgumentException("rateLimit windowMs must be > 0, got: " + windowMs);
                }
            }
            return new HandlerOptions(this);
        }
    }
}
