package com.example;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.txretry.core.RetryExecutor;
import com.example.txretry.core.config.RetrySettingsLoader;
import com.example.txretry.core.jdbc.DataSourceScopeFactory;
import com.example.txretry.core.jdbc.DbClient;
import java.util.Optional;
import javax.sql.DataSource;

/**
 * Demo application: adds an item to alice's shopping list, reads it, marks it bought and deletes
 * it, each step in its own retried CockroachDB transaction.
 *
 * <p>Connection settings come from the system properties {@code shopping.db.url}, {@code
 * shopping.db.user} and {@code shopping.db.password} (environment variables {@code
 * SHOPPING_DB_URL}, {@code SHOPPING_DB_USER}, {@code SHOPPING_DB_PASSWORD}), defaulting to an
 * insecure local node. Retry limits are read with {@link RetrySettingsLoader#load()}.
 */
public class Main {

  private static final System.Logger LOGGER = System.getLogger(Main.class.getName());

  static final String DEFAULT_URL = "jdbc:postgresql://localhost:26257/chores?sslmode=disable";
  static final String USERNAME = "alice";

  /**
   * Entry point.
   *
   * @param args CLI args (unused)
   * @throws Exception on unexpected failures
   */
  public static void main(final String[] args) throws Exception {
    try (final var dataSource =
        Pool.hikari(
            setting("shopping.db.url", "SHOPPING_DB_URL", DEFAULT_URL),
            setting("shopping.db.user", "SHOPPING_DB_USER", "root"),
            setting("shopping.db.password", "SHOPPING_DB_PASSWORD", ""))) {
      run(new ShoppingList(client(dataSource)));
    }
  }

  /**
   * Builds a client using CockroachDB's restart savepoint and the configured retry budget.
   *
   * @param dataSource the pool
   * @return the client
   */
  static DbClient client(final DataSource dataSource) {
    return new DbClient(
        RetryExecutor.builder(DataSourceScopeFactory.cockroach(dataSource))
            .budget(RetrySettingsLoader.load().toBudget())
            .attemptListener(
                attempt -> LOGGER.log(DEBUG, "Attempt {0}: {1}", attempt.attemptNumber(), attempt))
            .build());
  }

  static void run(final ShoppingList list) throws Exception {
    list.createTable();

    final var apples = list.add(USERNAME, "Gala apples", 3);
    LOGGER.log(INFO, "Added shopping list item: {0}", apples);

    list.first(USERNAME)
        .ifPresent(item -> LOGGER.log(INFO, "Retrieved a row from shopping_lists: {0}", item));

    list.markFirstBought(USERNAME)
        .ifPresent(item -> LOGGER.log(INFO, "Modified a shopping list item: {0}", item));

    final var remaining = list.deleteFirst(USERNAME);
    LOGGER.log(INFO, "Deleted a row in shopping_lists. Rows in shopping_lists: {0}", remaining);
  }

  private static String setting(final String property, final String env, final String fallback) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .orElse(fallback);
  }
}
