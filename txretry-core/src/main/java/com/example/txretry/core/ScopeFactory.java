package com.example.txretry.core;

import java.sql.SQLException;

/**
 * Opens a fresh {@link TransactionScope}. The executor calls it once per attempt, or once per run
 * when the scope supports restart.
 *
 * @param <S> scope type
 */
@FunctionalInterface
public interface ScopeFactory<S extends TransactionScope> {

  /**
   * Opens a new scope. The transaction is not begun yet.
   *
   * @return new scope
   * @throws SQLException if no session can be obtained
   */
  S open() throws SQLException;
}
