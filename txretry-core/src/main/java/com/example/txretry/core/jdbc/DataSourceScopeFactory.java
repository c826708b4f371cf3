package com.example.txretry.core.jdbc;

import com.example.txretry.core.ScopeFactory;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Opens a {@link JdbcTransactionScope} on a fresh connection from a {@link DataSource}, typically a
 * connection pool.
 *
 * <pre>{@code
 * var config = new HikariConfig();
 * config.setJdbcUrl("jdbc:postgresql://localhost:26257/chores?sslmode=disable");
 * config.setUsername("root");
 * var scopes = DataSourceScopeFactory.cockroach(new HikariDataSource(config));
 * }</pre>
 *
 * @param dataSource where connections come from
 * @param isolationLevel a {@code Connection.TRANSACTION_*} constant
 * @param restartSavepointName savepoint enabling in-session restarts, null to disable
 */
public record DataSourceScopeFactory(
    DataSource dataSource, int isolationLevel, String restartSavepointName)
    implements ScopeFactory<JdbcTransactionScope> {

  /** Savepoint name CockroachDB treats as its client-side retry checkpoint. */
  public static final String COCKROACH_RESTART = "cockroach_restart";

  public DataSourceScopeFactory {
    Objects.requireNonNull(dataSource, "dataSource");
    if (restartSavepointName != null && restartSavepointName.isBlank())
      throw new IllegalArgumentException("restartSavepointName must not be blank");
  }

  /**
   * Serializable transactions without in-session restarts.
   *
   * @param dataSource the data source
   * @return scope factory
   */
  public static DataSourceScopeFactory of(final DataSource dataSource) {
    return new DataSourceScopeFactory(dataSource, Connection.TRANSACTION_SERIALIZABLE, null);
  }

  /**
   * Serializable transactions restarted through the {@value #COCKROACH_RESTART} savepoint.
   *
   * @param dataSource the data source
   * @return scope factory
   */
  public static DataSourceScopeFactory cockroach(final DataSource dataSource) {
    return new DataSourceScopeFactory(
        dataSource, Connection.TRANSACTION_SERIALIZABLE, COCKROACH_RESTART);
  }

  @Override
  public JdbcTransactionScope open() throws SQLException {
    return new JdbcTransactionScope(
        dataSource.getConnection(), isolationLevel, restartSavepointName);
  }
}
