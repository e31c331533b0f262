package ch.so.arp.rag.pipeline;

import java.time.Duration;
import java.util.Optional;

/**
 * The external service rejected a call because of its rate limit. Retried
 * like any transient failure, but with a more conservative backoff.
 */
public class RateLimitException extends TransientFailureException {

    private final Duration retryAfter;

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public RateLimitException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Delay suggested by the service, if it sent one.
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
