package com.example;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;

public class Pool {

  private Pool() {}

  /**
   * Builds a HikariCP pool for a PostgreSQL-wire database such as CockroachDB.
   *
   * @param jdbcUrl JDBC URL, e.g. {@code jdbc:postgresql://localhost:26257/chores?sslmode=disable}
   * @param username database user
   * @param password database password, may be empty for insecure clusters
   * @return a started pool
   */
  public static HikariDataSource hikari(
      final String jdbcUrl, final String username, final String password) {
    final var config = new HikariConfig();
    config.setJdbcUrl(jdbcUrl);
    config.setUsername(username);
    config.setPassword(password);
    config.setMaximumPoolSize(10);
    config.setPoolName("shopping-list");
    config.setConnectionTimeout(Duration.ofSeconds(5).toMillis());
    return new HikariDataSource(config);
  }
}
