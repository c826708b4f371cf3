package com.example;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.zaxxer.hikari.HikariDataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.CockroachContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the shopping-list flow against a single-node CockroachDB and checks that contended
 * transactions are retried through the restart savepoint.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
public class ShoppingListIntegrationTest {

  private static final DockerImageName COCKROACH_IMAGE =
      DockerImageName.parse("cockroachdb/cockroach:v23.2.4");

  private CockroachContainer cockroach;
  private HikariDataSource dataSource;
  private ShoppingList list;

  @BeforeAll
  void setup() throws Exception {
    assumeTrue(dockerAvailable(), "Docker not available, skipping integration test");

    cockroach = new CockroachContainer(COCKROACH_IMAGE);
    cockroach.start();

    dataSource = Pool.hikari(cockroach.getJdbcUrl(), cockroach.getUsername(), "");
    list = new ShoppingList(Main.client(dataSource));
    list.createTable();
  }

  @AfterAll
  void cleanup() {
    if (dataSource != null) dataSource.close();
    if (cockroach != null) cockroach.stop();
  }

  @Test
  void runsTheFourTransactions() throws Exception {
    final var added = list.add("alice", "Gala apples", 3);
    assertEquals("Gala apples", added.item());
    assertEquals(3, added.quantity());
    assertFalse(added.bought());
    assertNotNull(added.added());

    final var read = list.first("alice").orElseThrow();
    assertEquals(added.itemId(), read.itemId());

    final var bought = list.markFirstBought("alice").orElseThrow();
    assertTrue(bought.bought());

    assertEquals(0, list.deleteFirst("alice"));
    assertTrue(list.first("alice").isEmpty());
  }

  @Test
  void mainRunsAgainstTheContainer() throws Exception {
    Main.run(list);

    assertEquals(0, list.count(Main.USERNAME));
  }

  @Test
  void concurrentWritersAllCommit() throws Exception {
    final var writers = 4;
    final var perWriter = 5;
    final var start = new CountDownLatch(1);
    final var pool = Executors.newFixedThreadPool(writers);
    try {
      final List<Future<Void>> futures = new ArrayList<>();
      for (int w = 0; w < writers; w++) {
        final var item = "item-" + w;
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perWriter; i++) {
                    list.add("bob", item, i);
                    list.markFirstBought("bob");
                  }
                  return null;
                }));
      }
      start.countDown();
      for (final var future : futures) future.get(2, TimeUnit.MINUTES);
    } finally {
      pool.shutdownNow();
    }

    assertEquals(writers * perWriter, list.count("bob"));
  }

  private static boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }
}
