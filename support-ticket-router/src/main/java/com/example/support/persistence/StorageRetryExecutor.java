package com.example.support.persistence;

import com.example.support.service.exception.StorageUnavailableException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Runs storage calls under a bounded retry policy. Only connectivity-type failures are retried;
 * anything else propagates on the first attempt. A transient failure that outlives the retry budget
 * surfaces as {@link StorageUnavailableException}.
 */
@Slf4j
public class StorageRetryExecutor {

    private static final Map<Class<? extends Throwable>, Boolean> TRANSIENT_FAILURES = Map.of(
            TransientDataAccessException.class, true,
            RecoverableDataAccessException.class, true,
            DataAccessResourceFailureException.class, true,
            CannotCreateTransactionException.class, true,
            SQLTransientException.class, true,
            SQLRecoverableException.class, true);

    private final RetryTemplate retryTemplate;
    private final BinaryExceptionClassifier transientClassifier;

    public StorageRetryExecutor(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxAttempts, TRANSIENT_FAILURES, true));
        this.retryTemplate.setBackOffPolicy(new LinearBackOffPolicy(baseDelay, sleeper));
        this.retryTemplate.setThrowLastExceptionOnExhausted(true);
        this.transientClassifier = new BinaryExceptionClassifier(TRANSIENT_FAILURES, false);
        this.transientClassifier.setTraverseCauses(true);
    }

    public <T> T execute(String operation, Supplier<T> action) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying storage operation {} (attempt {}) after: {}",
                            operation, context.getRetryCount() + 1, context.getLastThrowable().toString());
                }
                return action.get();
            });
        } catch (RuntimeException ex) {
            if (transientClassifier.classify(ex)) {
                log.error("Storage operation {} failed after retries", operation, ex);
                throw new StorageUnavailableException(operation, ex);
            }
            throw ex;
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }
}
