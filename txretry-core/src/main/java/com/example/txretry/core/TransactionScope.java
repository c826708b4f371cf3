package com.example.txretry.core;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * One logical transaction on a session owned exclusively by the attempt running in it.
 *
 * <p>Implemented by the storage-access layer; the executor only drives the lifecycle. A scope is
 * handed from one attempt to the next only through {@link #restart()}.
 */
public interface TransactionScope extends AutoCloseable {

  /**
   * Starts the transaction.
   *
   * @throws SQLException if the session cannot start a transaction
   */
  void begin() throws SQLException;

  /**
   * Commits the transaction.
   *
   * @throws SQLException on failure, including serialization conflicts detected at commit
   */
  void commit() throws SQLException;

  /**
   * Discards the transaction. Safe to call more than once and after a failed commit.
   *
   * @throws SQLException if the store rejects the rollback
   */
  void rollback() throws SQLException;

  /**
   * Discards the partial writes of the current attempt and continues on the same session from the
   * checkpoint set by {@link #begin()}. Only called when {@link #supportsRestart()} is true.
   *
   * @throws SQLException if the checkpoint is no longer usable
   */
  default void restart() throws SQLException {
    throw new SQLFeatureNotSupportedException("restart is not supported by " + getClass());
  }

  /**
   * Whether {@link #restart()} is available.
   *
   * @return true if the scope has a restart checkpoint
   */
  default boolean supportsRestart() {
    return false;
  }

  /**
   * Releases the session. Called after {@link #commit()} or {@link #rollback()}.
   *
   * @throws SQLException if releasing fails
   */
  @Override
  void close() throws SQLException;
}
