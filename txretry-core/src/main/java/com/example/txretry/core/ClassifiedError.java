package com.example.txretry.core;

import java.util.Objects;

/**
 * A failure labelled by an {@link ErrorClassifier}.
 *
 * @param kind the category of the failure
 * @param retryable whether the executor may replay the unit of work
 * @param cause the original failure, may be null for synthetic classifications
 */
public record ClassifiedError(ErrorKind kind, boolean retryable, Throwable cause) {

  public ClassifiedError {
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Classifies {@code cause} with the default retryability of {@code kind}.
   *
   * @param kind the category
   * @param cause the original failure
   * @return classified error
   */
  public static ClassifiedError of(final ErrorKind kind, final Throwable cause) {
    return new ClassifiedError(kind, kind.retryableByDefault(), cause);
  }

  /**
   * Shorthand for an unrecognized failure.
   *
   * @param cause the original failure
   * @return a non-retryable {@link ErrorKind#UNKNOWN} classification
   */
  public static ClassifiedError unknown(final Throwable cause) {
    return of(ErrorKind.UNKNOWN, cause);
  }

  /**
   * Returns a copy that is never retried, keeping kind and cause.
   *
   * @return non-retryable copy
   */
  public ClassifiedError asFatal() {
    return retryable ? new ClassifiedError(kind, false, cause) : this;
  }

  @Override
  public String toString() {
    final var detail = cause == null ? "" : ": " + cause;
    return kind + (retryable ? " (retryable)" : " (fatal)") + detail;
  }
}
