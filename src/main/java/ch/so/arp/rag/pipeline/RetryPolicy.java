package ch.so.arp.rag.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff settings. The delay before retry {@code n} is
 * {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}. Rate
 * limited calls wait {@code rateLimitMultiplier} times longer and never less
 * than the delay suggested by the service.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier,
        double rateLimitMultiplier) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 <= initialDelay <= maxDelay");
        }
        if (multiplier < 1.0d || rateLimitMultiplier < 1.0d) {
            throw new IllegalArgumentException("multipliers must be at least 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofMillis(500), Duration.ofSeconds(30), 2.0d, 2.0d);
    }

    /**
     * Delay to wait after the given failed attempt (1 based).
     */
    Duration delayAfter(int attempt, RuntimeException failure) {
        double factor = Math.pow(multiplier, attempt - 1);
        long millis = cap(initialDelay.toMillis() * factor, maxDelay.toMillis());
        if (failure instanceof RateLimitException rateLimit) {
            long rateLimitCap = cap(maxDelay.toMillis() * rateLimitMultiplier, Long.MAX_VALUE);
            long conservative = cap(millis * rateLimitMultiplier, rateLimitCap);
            long hinted = rateLimit.getRetryAfter().map(Duration::toMillis).orElse(0L);
            millis = Math.min(Math.max(conservative, hinted), rateLimitCap);
        }
        return Duration.ofMillis(millis);
    }

    private static long cap(double value, long max) {
        return value >= max ? max : (long) value;
    }
}
