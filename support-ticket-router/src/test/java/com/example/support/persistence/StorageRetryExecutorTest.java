package com.example.support.persistence;

import com.example.support.service.exception.StorageUnavailableException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StorageRetryExecutor")
class StorageRetryExecutorTest {

    private final List<Long> sleeps = new ArrayList<>();
    private StorageRetryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new StorageRetryExecutor(3, Duration.ofMillis(500), sleeps::add);
    }

    @Test
    @DisplayName("Should return the result without retrying when the first attempt succeeds")
    void shouldReturnOnFirstSuccess() {
        String result = executor.execute("ticket.findById", () -> "ok");

        assertThat(result).isEqualTo("ok");
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should retry transient failures with linearly growing delays")
    void shouldRetryWithLinearBackOff() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.execute("ticket.create", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            return "created";
        });

        assertThat(result).isEqualTo("created");
        assertThat(attempts).hasValue(3);
        assertThat(sleeps).containsExactly(500L, 1000L);
    }

    @Test
    @DisplayName("Should report storage unavailable once all attempts fail transiently")
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.run("ticket.updateStatus", () -> {
            attempts.incrementAndGet();
            throw new CannotGetJdbcConnectionException("pool exhausted");
        }))
                .isInstanceOf(StorageUnavailableException.class)
                .hasCauseInstanceOf(CannotGetJdbcConnectionException.class);

        assertThat(attempts).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("Should classify a wrapped SQL transient exception as retryable")
    void shouldRetryWrappedSqlTransientFailure() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("account.findByPhone", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("wrapped", new SQLTransientConnectionException("timeout"));
        })).isInstanceOf(StorageUnavailableException.class);

        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Should propagate non-transient failures immediately")
    void shouldNotRetryPermanentFailures() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("ticket.create", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("null description");
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
    }
}
