package com.example.txretry.core;

import java.time.Duration;
import java.util.List;

/** The caller cancelled the run or interrupted its thread. Never retried. */
public class TransactionCancelledException extends TransactionFailedException {

  private static final long serialVersionUID = 1L;

  public TransactionCancelledException(
      final ClassifiedError lastError, final List<AttemptRecord> attempts, final Duration elapsed) {
    super("Cancelled", lastError, attempts, elapsed);
  }
}
