package com.example.txretry.core;

import java.time.Duration;
import java.util.List;

/** The retry budget ran out while the last failure was still retryable. */
public class RetriesExhaustedException extends TransactionFailedException {

  private static final long serialVersionUID = 1L;

  public RetriesExhaustedException(
      final ClassifiedError lastError, final List<AttemptRecord> attempts, final Duration elapsed) {
    super("Retries exhausted", lastError, attempts, elapsed);
  }
}
