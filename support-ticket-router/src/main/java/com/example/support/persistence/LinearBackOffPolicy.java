package com.example.support.persistence;

import java.time.Duration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Waits {@code baseDelay * n} before the n-th retry.
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long baseDelayMillis;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(Duration baseDelay, Sleeper sleeper) {
        this.baseDelayMillis = Math.max(0L, baseDelay.toMillis());
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new LinearBackOffContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        LinearBackOffContext context = (LinearBackOffContext) backOffContext;
        context.attempt++;
        try {
            sleeper.sleep(baseDelayMillis * context.attempt);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted during storage retry back-off", ex);
        }
    }

    private static final class LinearBackOffContext implements BackOffContext {
        private int attempt;
    }
}
