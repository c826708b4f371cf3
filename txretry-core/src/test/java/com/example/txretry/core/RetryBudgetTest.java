package com.example.txretry.core;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.*;

public class RetryBudgetTest {

  @Test
  @DisplayName("Should expose documented defaults")
  void shouldExposeDefaults() {
    final var budget = RetryBudget.defaults();

    assertEquals(5, budget.maxAttempts());
    assertEquals(Duration.ofSeconds(30), budget.maxElapsed());
    final var policy = assertInstanceOf(ExponentialBackoff.class, budget.policy());
    assertEquals(Duration.ofMillis(50), policy.baseDelay());
    assertEquals(Duration.ofSeconds(5), policy.maxDelay());
    assertEquals(0.5, policy.jitterFactor());
  }

  @Test
  @DisplayName("Should reject invalid limits")
  void shouldRejectInvalidLimits() {
    final var policy = BackoffPolicy.none();
    assertThrows(
        IllegalArgumentException.class, () -> new RetryBudget(0, Duration.ofSeconds(1), policy));
    assertThrows(IllegalArgumentException.class, () -> new RetryBudget(1, Duration.ZERO, policy));
    assertThrows(
        IllegalArgumentException.class, () -> new RetryBudget(1, Duration.ofSeconds(-1), policy));
    assertThrows(NullPointerException.class, () -> new RetryBudget(1, null, policy));
    assertThrows(
        NullPointerException.class, () -> new RetryBudget(1, Duration.ofSeconds(1), null));
  }

  @Test
  @DisplayName("Should copy with a single change")
  void shouldCopyWithChanges() {
    final var budget = RetryBudget.defaults().withMaxAttempts(9).withPolicy(BackoffPolicy.none());

    assertEquals(9, budget.maxAttempts());
    assertEquals(RetryBudget.DEFAULT_MAX_ELAPSED, budget.maxElapsed());
    assertEquals(Duration.ZERO, budget.policy().delay(4));
    assertEquals(Duration.ofSeconds(2), budget.withMaxElapsed(Duration.ofSeconds(2)).maxElapsed());
    assertEquals(1, RetryBudget.singleAttempt().maxAttempts());
  }

  @Test
  @DisplayName("Should validate attempt records")
  void shouldValidateAttemptRecords() {
    final var now = Instant.now();
    final var error = ClassifiedError.unknown(new IllegalStateException());

    assertThrows(
        IllegalArgumentException.class,
        () -> new AttemptRecord(0, now, AttemptRecord.Outcome.COMMITTED, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new AttemptRecord(1, now, AttemptRecord.Outcome.COMMITTED, error));
    assertThrows(
        IllegalArgumentException.class,
        () -> new AttemptRecord(1, now, AttemptRecord.Outcome.FATAL, null));
  }

  @Test
  @DisplayName("Should describe failures with attempt number and elapsed time")
  void shouldDescribeFailure() {
    final var error = ClassifiedError.of(ErrorKind.SERIALIZATION, new SQLException("x", "40001"));
    final var attempts =
        List.of(
            new AttemptRecord(1, Instant.EPOCH, AttemptRecord.Outcome.RETRYABLE, error),
            new AttemptRecord(2, Instant.EPOCH, AttemptRecord.Outcome.RETRYABLE, error));

    final var ex = new RetriesExhaustedException(error, attempts, Duration.ofMillis(120));

    assertEquals(2, ex.attemptNumber());
    assertEquals("40001", ex.getSQLState());
    assertTrue(ex.getMessage().startsWith("Retries exhausted after attempt 2 (120 ms)"));
    assertThrows(UnsupportedOperationException.class, () -> ex.attempts().clear());
  }
}
