package com.example.txretry.core.jdbc;

import com.example.txretry.core.TransactionScope;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Savepoint;
import java.util.Objects;

/**
 * {@link TransactionScope} over one JDBC {@link Connection}.
 *
 * <p>When a restart savepoint name is configured, {@link #begin()} sets that savepoint right after
 * the transaction starts and {@link #restart()} rolls back to it. CockroachDB recognizes the name
 * {@code cockroach_restart} and keeps the transaction's priority across such restarts, which makes
 * later attempts more likely to win the conflict.
 */
public final class JdbcTransactionScope implements TransactionScope {

  private final Connection connection;
  private final int isolationLevel;
  private final String restartSavepointName;

  private boolean previousAutoCommit = true;
  private Savepoint restartSavepoint;
  private boolean active;

  /**
   * Wraps a connection.
   *
   * @param connection the connection, owned by this scope from now on
   * @param isolationLevel a {@code Connection.TRANSACTION_*} constant, or {@code
   *     Connection.TRANSACTION_NONE} to keep the connection's level
   * @param restartSavepointName savepoint used by {@link #restart()}, null to disable restarts
   */
  public JdbcTransactionScope(
      final Connection connection, final int isolationLevel, final String restartSavepointName) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.isolationLevel = isolationLevel;
    this.restartSavepointName = restartSavepointName;
  }

  /**
   * The connection the unit of work issues statements on.
   *
   * @return the open connection
   */
  public Connection connection() {
    return connection;
  }

  @Override
  public void begin() throws SQLException {
    previousAutoCommit = connection.getAutoCommit();
    if (isolationLevel != Connection.TRANSACTION_NONE)
      connection.setTransactionIsolation(isolationLevel);
    connection.setAutoCommit(false);
    active = true;
    if (restartSavepointName != null)
      restartSavepoint = connection.setSavepoint(restartSavepointName);
  }

  @Override
  public void commit() throws SQLException {
    if (restartSavepoint != null) connection.releaseSavepoint(restartSavepoint);
    connection.commit();
    active = false;
    restartSavepoint = null;
  }

  @Override
  public void rollback() throws SQLException {
    if (!active || connection.isClosed()) return;
    restartSavepoint = null;
    connection.rollback();
    active = false;
  }

  @Override
  public void restart() throws SQLException {
    if (restartSavepoint == null)
      throw new SQLFeatureNotSupportedException("no restart savepoint is set");
    connection.rollback(restartSavepoint);
  }

  @Override
  public boolean supportsRestart() {
    return restartSavepointName != null;
  }

  /**
   * Restores the original auto-commit mode and closes the connection. Auto-commit is left alone
   * while a transaction is still open, because switching it on would commit that transaction.
   */
  @Override
  public void close() throws SQLException {
    try {
      if (!connection.isClosed() && !active) connection.setAutoCommit(previousAutoCommit);
    } finally {
      connection.close();
    }
  }
}
