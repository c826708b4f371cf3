package com.example.txretry.core;

import java.sql.SQLException;

/**
 * Runs a unit of work once inside a begun scope and commits it.
 *
 * <p>A connection loss reported by the commit itself is downgraded to non-retryable: the store may
 * have applied the commit before the connection dropped, and replaying the work would apply it a
 * second time.
 */
final class Attempt {

  private Attempt() {}

  /**
   * Result of one attempt: a committed value, or the classified failure.
   *
   * @param value the unit of work's result when committed
   * @param error the failure, null when committed
   * @param <T> result type
   */
  record Result<T>(T value, ClassifiedError error) {

    static <T> Result<T> committed(final T value) {
      return new Result<>(value, null);
    }

    static <T> Result<T> failed(final ClassifiedError error) {
      return new Result<>(null, error);
    }

    boolean isCommitted() {
      return error == null;
    }
  }

  static <S extends TransactionScope, T> Result<T> execute(
      final S scope, final UnitOfWork<S, T> work, final ErrorClassifier classifier) {
    final T value;
    try {
      value = work.execute(scope);
    } catch (final SQLException | RuntimeException e) {
      return Result.failed(classifier.classify(e));
    }

    try {
      scope.commit();
    } catch (final SQLException | RuntimeException e) {
      final var classified = classifier.classify(e);
      return Result.failed(
          classified.kind() == ErrorKind.CONNECTION_LOSS ? classified.asFatal() : classified);
    }
    return Result.committed(value);
  }
}
