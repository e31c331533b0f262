package ch.so.arp.rag.pipeline;

import java.time.Duration;

/**
 * Pauses the calling thread between retries. Tests replace it to observe the
 * backoff without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
