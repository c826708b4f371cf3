package com.example.txretry.core;

import java.sql.SQLException;

/**
 * Caller-defined work executed inside a transaction.
 *
 * <p>The executor may invoke it more than once, each time against a fresh transaction, and
 * commits the effects of at most one invocation. Implementations must therefore not capture
 * mutable state that makes a later invocation diverge from the first, and must not perform side
 * effects visible outside the transaction (printing, remote calls); do those with the returned
 * value after {@link RetryExecutor#run} returns.
 *
 * @param <S> scope type
 * @param <T> result type
 */
@FunctionalInterface
public interface UnitOfWork<S extends TransactionScope, T> {

  /**
   * Runs the work.
   *
   * @param scope the begun transaction
   * @return the result, may be null
   * @throws SQLException on database errors
   */
  T execute(S scope) throws SQLException;
}
