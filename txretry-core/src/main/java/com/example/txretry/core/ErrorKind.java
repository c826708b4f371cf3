package com.example.txretry.core;

/** Category assigned to a storage-layer failure by an {@link ErrorClassifier}. */
public enum ErrorKind {
  /** Optimistic-concurrency conflict; the transaction was aborted and can be replayed. */
  SERIALIZATION(true),

  /** Transport-level failure before the transaction reached a commit decision. */
  CONNECTION_LOSS(true),

  /** Uniqueness, foreign-key or check violation. Replaying yields the same outcome. */
  CONSTRAINT_VIOLATION(false),

  /** Statement timeout, cancellation or interruption requested by the caller. */
  TIMEOUT(false),

  /** Not recognized. Never retried. */
  UNKNOWN(false);

  private final boolean retryableByDefault;

  ErrorKind(final boolean retryableByDefault) {
    this.retryableByDefault = retryableByDefault;
  }

  /**
   * Whether errors of this kind are retried unless a classifier says otherwise.
   *
   * @return default retryability
   */
  public boolean retryableByDefault() {
    return retryableByDefault;
  }
}
