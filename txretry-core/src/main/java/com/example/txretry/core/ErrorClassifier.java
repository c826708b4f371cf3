package com.example.txretry.core;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Labels failures raised by a {@link TransactionScope} or a {@link UnitOfWork}.
 *
 * <p>Implementations must fail closed: anything they do not positively recognize as transient is
 * reported as {@link ErrorKind#UNKNOWN}, which the executor never retries.
 *
 * <h3>Using the Default Classifier</h3>
 *
 * <pre>{@code
 * final var classified = ErrorClassifier.defaultClassifier().classify(sqlException);
 * if (classified.retryable()) {
 *     // replay the transaction
 * }
 * }</pre>
 *
 * <h3>Adding Vendor Error Codes</h3>
 *
 * <pre>{@code
 * var mysqlDeadlock = ErrorClassifier.matching(
 *     t -> t instanceof SQLException e && e.getErrorCode() == 1213,
 *     ErrorKind.SERIALIZATION);
 *
 * var classifier = mysqlDeadlock.orElse(ErrorClassifier.defaultClassifier());
 * }</pre>
 */
@FunctionalInterface
public interface ErrorClassifier {

  /**
   * Classifies a failure.
   *
   * @param error the failure, may be null
   * @return the classification, never null
   */
  ClassifiedError classify(Throwable error);

  /**
   * Returns the SQLState based classifier.
   *
   * @return default classifier
   */
  static ErrorClassifier defaultClassifier() {
    return SqlStateErrorClassifier.INSTANCE;
  }

  /**
   * Creates a classifier that assigns {@code kind} to every failure accepted by {@code predicate}
   * and {@link ErrorKind#UNKNOWN} to everything else.
   *
   * @param predicate the matching rule
   * @param kind the kind to assign on a match
   * @return custom classifier
   */
  static ErrorClassifier matching(final Predicate<Throwable> predicate, final ErrorKind kind) {
    Objects.requireNonNull(predicate, "predicate");
    Objects.requireNonNull(kind, "kind");
    return e ->
        e != null && predicate.test(e) ? ClassifiedError.of(kind, e) : ClassifiedError.unknown(e);
  }

  /**
   * Combines this classifier with a fallback that is consulted only when this one answers {@link
   * ErrorKind#UNKNOWN}.
   *
   * @param fallback the classifier to consult next
   * @return combined classifier
   */
  default ErrorClassifier orElse(final ErrorClassifier fallback) {
    Objects.requireNonNull(fallback, "fallback");
    return e -> {
      final var first = this.classify(e);
      return first.kind() == ErrorKind.UNKNOWN ? fallback.classify(e) : first;
    };
  }
}
