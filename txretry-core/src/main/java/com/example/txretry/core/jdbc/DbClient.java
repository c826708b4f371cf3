package com.example.txretry.core.jdbc;

import com.example.txretry.core.CancellationToken;
import com.example.txretry.core.RetryBudget;
import com.example.txretry.core.RetryExecutor;
import com.example.txretry.core.TransactionFailedException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Thin database client that runs JDBC operations in serializable transactions and replays them on
 * serialization conflicts and connection losses.
 *
 * <pre>{@code
 * var client = DbClient.cockroach(hikariDataSource);
 *
 * int updated = client.inTransaction(conn -> {
 *     try (var ps = conn.prepareStatement(
 *         "UPDATE shopping_lists SET bought = true WHERE username = ?")) {
 *         ps.setString(1, "alice");
 *         return ps.executeUpdate();
 *     }
 * });
 * }</pre>
 *
 * @param executor the executor running every transaction
 */
public record DbClient(RetryExecutor<JdbcTransactionScope> executor) {

  public DbClient {
    Objects.requireNonNull(executor, "executor");
  }

  /**
   * Client with default budget and plain serializable transactions.
   *
   * @param dataSource the data source
   * @return new client
   */
  public static DbClient create(final DataSource dataSource) {
    return new DbClient(
        new RetryExecutor<>(DataSourceScopeFactory.of(dataSource), RetryBudget.defaults()));
  }

  /**
   * Client with default budget using CockroachDB's savepoint restart protocol.
   *
   * @param dataSource the data source
   * @return new client
   */
  public static DbClient cockroach(final DataSource dataSource) {
    return new DbClient(
        new RetryExecutor<>(DataSourceScopeFactory.cockroach(dataSource), RetryBudget.defaults()));
  }

  /**
   * Runs the operation in a transaction using the executor's default budget.
   *
   * @param operation the database operation to run with an open {@link Connection}
   * @param <T> the operation result type
   * @return the value returned by the committed invocation
   * @throws TransactionFailedException if the operation could not be committed
   */
  public <T> T inTransaction(final DbOperation<T> operation) throws TransactionFailedException {
    return inTransaction(operation, executor.defaultBudget());
  }

  /**
   * Runs the operation in a transaction.
   *
   * @param operation the database operation to run with an open {@link Connection}
   * @param budget retry limits for this call
   * @param <T> the operation result type
   * @return the value returned by the committed invocation
   * @throws TransactionFailedException if the operation could not be committed
   */
  public <T> T inTransaction(final DbOperation<T> operation, final RetryBudget budget)
      throws TransactionFailedException {
    return inTransaction(operation, budget, CancellationToken.none());
  }

  /**
   * Runs the operation in a transaction that can be cancelled from another thread.
   *
   * @param operation the database operation to run with an open {@link Connection}
   * @param budget retry limits for this call
   * @param token cancellation signal
   * @param <T> the operation result type
   * @return the value returned by the committed invocation
   * @throws TransactionFailedException if the operation could not be committed
   */
  public <T> T inTransaction(
      final DbOperation<T> operation, final RetryBudget budget, final CancellationToken token)
      throws TransactionFailedException {
    Objects.requireNonNull(operation, "operation");
    return executor.run(scope -> operation.execute(scope.connection()), budget, token);
  }

  /**
   * Database operation executed against an open {@link Connection}. May run more than once.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface DbOperation<T> {
    /**
     * Executes the operation with the provided connection.
     *
     * @param conn an open JDBC connection inside a transaction
     * @return operation result
     * @throws SQLException on database errors
     */
    T execute(final Connection conn) throws SQLException;
  }
}
