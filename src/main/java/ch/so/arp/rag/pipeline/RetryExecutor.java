package ch.so.arp.rag.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs calls against external services and repeats them after transient
 * failures according to a {@link RetryPolicy}. Once the attempts are used up
 * the last failure is surfaced as a {@link PermanentFailureException}. Other
 * exceptions pass through untouched.
 */
public class RetryExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1;; attempt++) {
            try {
                return call.get();
            } catch (TransientFailureException ex) {
                if (attempt >= policy.maxAttempts()) {
                    throw new PermanentFailureException(
                            operation + " failed after " + attempt + " attempts: " + ex.getMessage(), ex);
                }
                Duration delay = policy.delayAfter(attempt, ex);
                LOGGER.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", operation, attempt,
                        policy.maxAttempts(), delay.toMillis(), ex.getMessage());
                pause(operation, delay, ex);
            }
        }
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private void pause(String operation, Duration delay, RuntimeException failure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            PermanentFailureException interrupted = new PermanentFailureException(
                    operation + " interrupted while waiting to retry", ex);
            interrupted.addSuppressed(failure);
            throw interrupted;
        }
    }
}
