package com.example;

import java.time.OffsetDateTime;
import java.util.UUID;

/** One row of the {@code shopping_lists} table. */
public record ShoppingListItem(
    String username,
    UUID itemId,
    OffsetDateTime added,
    String item,
    int quantity,
    boolean bought) {

  @Override
  public String toString() {
    return "%s %s %s %s %d %s".formatted(username, itemId, item, added, quantity, bought);
  }
}
