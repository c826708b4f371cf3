package com.example.txretry.core;

import io.r2dbc.spi.R2dbcException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * Thrown by {@link RetryExecutor#run} when the unit of work could not be committed.
 *
 * <p>The base type signals a fatal classification. {@link RetriesExhaustedException} and {@link
 * TransactionCancelledException} cover the other terminal failures. The SQLState of the
 * underlying {@link SQLException} or {@link R2dbcException}, when there is one, is carried over.
 */
public class TransactionFailedException extends SQLException {

  private static final long serialVersionUID = 1L;

  private final transient ClassifiedError error;
  private final transient List<AttemptRecord> attempts;
  private final Duration elapsed;

  public TransactionFailedException(
      final String reason,
      final ClassifiedError error,
      final List<AttemptRecord> attempts,
      final Duration elapsed) {
    super(
        describe(reason, attempts.size(), elapsed, error),
        sqlStateOf(error),
        error == null ? null : error.cause());
    this.error = error;
    this.attempts = List.copyOf(attempts);
    this.elapsed = elapsed;
  }

  /**
   * Classification of the last failure.
   *
   * @return last classified error, null if cancelled before the first attempt
   */
  public ClassifiedError error() {
    return error;
  }

  /**
   * Records of every attempt made, in order.
   *
   * @return immutable attempt list
   */
  public List<AttemptRecord> attempts() {
    return attempts;
  }

  /**
   * Number of the final attempt, 0 if none started.
   *
   * @return final attempt number
   */
  public int attemptNumber() {
    return attempts.size();
  }

  /** Time from the start of the run to the terminal failure. */
  public Duration elapsed() {
    return elapsed;
  }

  private static String describe(
      final String reason, final int attempt, final Duration elapsed, final ClassifiedError error) {
    final var base = "%s after attempt %d (%d ms)".formatted(reason, attempt, elapsed.toMillis());
    return error == null ? base : base + ": " + error;
  }

  private static String sqlStateOf(final ClassifiedError error) {
    if (error == null) return null;
    Throwable cur = error.cause();
    while (cur != null) {
      if (cur instanceof SQLException sql && sql.getSQLState() != null) return sql.getSQLState();
      if (cur instanceof R2dbcException r2dbc && r2dbc.getSqlState() != null)
        return r2dbc.getSqlState();
      cur = cur.getCause();
    }
    return null;
  }
}
