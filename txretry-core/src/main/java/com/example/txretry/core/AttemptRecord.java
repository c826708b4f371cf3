package com.example.txretry.core;

import java.time.Instant;
import java.util.Objects;

/**
 * What happened to one attempt of a {@link RetryExecutor#run} call. Records live only as long as
 * the run that produced them.
 *
 * @param attemptNumber 1-based attempt number, gap-free within a run
 * @param startedAt when the attempt started
 * @param outcome how the attempt ended
 * @param error classification of the failure, null when committed
 */
public record AttemptRecord(
    int attemptNumber, Instant startedAt, Outcome outcome, ClassifiedError error) {

  public AttemptRecord {
    if (attemptNumber < 1) throw new IllegalArgumentException("attemptNumber must be >= 1");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(outcome, "outcome");
    if (outcome == Outcome.COMMITTED && error != null)
      throw new IllegalArgumentException("committed attempt cannot carry an error");
    if (outcome != Outcome.COMMITTED && error == null)
      throw new IllegalArgumentException("failed attempt must carry an error");
  }

  /** How an attempt ended. */
  public enum Outcome {
    COMMITTED,
    RETRYABLE,
    FATAL
  }
}
