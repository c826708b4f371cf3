package com.example;

import com.example.txretry.core.TransactionFailedException;
import com.example.txretry.core.jdbc.DbClient;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Shopping list stored in CockroachDB. Every method runs in its own retried transaction; callers
 * act on the returned values only after the transaction has committed.
 */
public class ShoppingList {

  private static final String COLUMNS = "username, item_id, added, item, quantity, bought";

  private final DbClient client;

  public ShoppingList(final DbClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  /**
   * Creates the table if it does not exist yet.
   *
   * @throws TransactionFailedException if the statement cannot be committed
   */
  public void createTable() throws TransactionFailedException {
    client.inTransaction(
        conn -> {
          try (final var st = conn.createStatement()) {
            st.execute(
                """
                CREATE TABLE IF NOT EXISTS shopping_lists (
                  username STRING NOT NULL,
                  item_id UUID NOT NULL,
                  added TIMESTAMPTZ NOT NULL DEFAULT now(),
                  item STRING,
                  quantity INT,
                  bought BOOL NOT NULL DEFAULT false,
                  PRIMARY KEY (username, item_id)
                )
                """);
          }
          return null;
        });
  }

  /**
   * Adds an item for a user.
   *
   * @param username owner of the list
   * @param item item description
   * @param quantity how many to buy
   * @return the inserted row
   * @throws TransactionFailedException if the insert cannot be committed
   */
  public ShoppingListItem add(final String username, final String item, final int quantity)
      throws TransactionFailedException {
    // generated outside the transaction so a retried attempt inserts the same key
    final var itemId = UUID.randomUUID();
    return client.inTransaction(
        conn -> {
          try (final var ps =
              conn.prepareStatement(
                  "INSERT INTO shopping_lists (username, item_id, item, quantity)"
                      + " VALUES (?, ?, ?, ?) RETURNING "
                      + COLUMNS)) {
            ps.setString(1, username);
            ps.setObject(2, itemId);
            ps.setString(3, item);
            ps.setInt(4, quantity);
            try (final var rs = ps.executeQuery()) {
              rs.next();
              return map(rs);
            }
          }
        });
  }

  /**
   * Reads the first item of a user's list.
   *
   * @param username owner of the list
   * @return the item, empty if the list is empty
   * @throws TransactionFailedException if the read cannot be committed
   */
  public Optional<ShoppingListItem> first(final String username)
      throws TransactionFailedException {
    return client.inTransaction(conn -> Optional.ofNullable(selectFirst(conn, username)));
  }

  /**
   * Marks the first item of a user's list as bought.
   *
   * @param username owner of the list
   * @return the updated item, empty if the list is empty
   * @throws TransactionFailedException if the update cannot be committed
   */
  public Optional<ShoppingListItem> markFirstBought(final String username)
      throws TransactionFailedException {
    return client.inTransaction(
        conn -> {
          final var current = selectFirst(conn, username);
          if (current == null) return Optional.empty();
          try (final var ps =
              conn.prepareStatement(
                  "UPDATE shopping_lists SET bought = true WHERE username = ? AND item_id = ?"
                      + " RETURNING "
                      + COLUMNS)) {
            ps.setString(1, username);
            ps.setObject(2, current.itemId());
            try (final var rs = ps.executeQuery()) {
              return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
          }
        });
  }

  /**
   * Deletes the first item of a user's list.
   *
   * @param username owner of the list
   * @return number of items left on the list
   * @throws TransactionFailedException if the delete cannot be committed
   */
  public long deleteFirst(final String username) throws TransactionFailedException {
    return client.inTransaction(
        conn -> {
          final var current = selectFirst(conn, username);
          if (current != null) {
            try (final var ps =
                conn.prepareStatement(
                    "DELETE FROM shopping_lists WHERE username = ? AND item_id = ?")) {
              ps.setString(1, username);
              ps.setObject(2, current.itemId());
              ps.executeUpdate();
            }
          }
          return count(conn, username);
        });
  }

  /**
   * Counts the items on a user's list.
   *
   * @param username owner of the list
   * @return number of items
   * @throws TransactionFailedException if the read cannot be committed
   */
  public long count(final String username) throws TransactionFailedException {
    return client.inTransaction(conn -> count(conn, username));
  }

  private static ShoppingListItem selectFirst(final Connection conn, final String username)
      throws SQLException {
    try (final var ps =
        conn.prepareStatement(
            "SELECT "
                + COLUMNS
                + " FROM shopping_lists WHERE username = ? ORDER BY added, item_id LIMIT 1")) {
      ps.setString(1, username);
      try (final var rs = ps.executeQuery()) {
        return rs.next() ? map(rs) : null;
      }
    }
  }

  private static long count(final Connection conn, final String username) throws SQLException {
    try (final var ps =
        conn.prepareStatement("SELECT count(*) FROM shopping_lists WHERE username = ?")) {
      ps.setString(1, username);
      try (final var rs = ps.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    }
  }

  private static ShoppingListItem map(final ResultSet rs) throws SQLException {
    return new ShoppingListItem(
        rs.getString("username"),
        rs.getObject("item_id", UUID.class),
        rs.getObject("added", OffsetDateTime.class),
        rs.getString("item"),
        rs.getInt("quantity"),
        rs.getBoolean("bought"));
  }
}
