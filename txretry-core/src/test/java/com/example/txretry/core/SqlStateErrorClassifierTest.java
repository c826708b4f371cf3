package com.example.txretry.core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.ConnectException;
import java.sql.BatchUpdateException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SqlStateErrorClassifierTest {

  private final ErrorClassifier classifier = ErrorClassifier.defaultClassifier();

  @Nested
  @DisplayName("SQLState mapping")
  class SqlStates {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
      "40001, SERIALIZATION",
      "40P01, SERIALIZATION",
      "40000, SERIALIZATION",
      "40002, CONSTRAINT_VIOLATION",
      "40003, UNKNOWN",
      "08000, CONNECTION_LOSS",
      "08006, CONNECTION_LOSS",
      "08S01, CONNECTION_LOSS",
      "57P01, CONNECTION_LOSS",
      "57P03, CONNECTION_LOSS",
      "23505, CONSTRAINT_VIOLATION",
      "23503, CONSTRAINT_VIOLATION",
      "57014, TIMEOUT",
      "42P01, UNKNOWN",
      "22003, UNKNOWN"
    })
    @DisplayName("Should map SQLState to error kind")
    void shouldMapSqlState(final String sqlState, final ErrorKind expected) {
      final var classified = classifier.classify(new SQLException("failure", sqlState));
      assertEquals(expected, classified.kind());
      assertEquals(expected.retryableByDefault(), classified.retryable());
    }

    @Test
    @DisplayName("Should treat an ambiguous commit state as fatal")
    void shouldNotRetryStatementCompletionUnknown() {
      final var classified =
          classifier.classify(new SQLException("result is ambiguous", "40003"));
      assertFalse(classified.retryable());
    }

    @Test
    @DisplayName("Should let SQLState win over the exception subtype")
    void shouldPreferSqlStateOverSubtype() {
      final var e = new SQLTransactionRollbackException("duplicate", "23505");
      assertEquals(ErrorKind.CONSTRAINT_VIOLATION, classifier.classify(e).kind());
    }

    @Test
    @DisplayName("Should ignore too-short SQLStates")
    void shouldIgnoreShortSqlState() {
      assertNull(SqlStateErrorClassifier.kindForSqlState("4"));
      assertNull(SqlStateErrorClassifier.kindForSqlState(null));
    }
  }

  @Nested
  @DisplayName("Exception types and messages")
  class TypesAndMessages {

    @Test
    @DisplayName("Should classify JDBC subtypes without SQLState")
    void shouldClassifySubtypes() {
      assertEquals(
          ErrorKind.SERIALIZATION,
          classifier.classify(new SQLTransactionRollbackException("rollback")).kind());
      assertEquals(
          ErrorKind.CONSTRAINT_VIOLATION,
          classifier.classify(new SQLIntegrityConstraintViolationException("dup")).kind());
      assertEquals(
          ErrorKind.CONNECTION_LOSS,
          classifier.classify(new SQLTransientConnectionException("gone")).kind());
      assertEquals(
          ErrorKind.CONNECTION_LOSS,
          classifier.classify(new SQLRecoverableException("gone")).kind());
      assertEquals(ErrorKind.TIMEOUT, classifier.classify(new SQLTimeoutException("slow")).kind());
    }

    @Test
    @DisplayName("Should fall back to message keywords")
    void shouldClassifyByMessage() {
      assertEquals(
          ErrorKind.SERIALIZATION,
          classifier
              .classify(new SQLException("ERROR: restart transaction: TransactionRetryError"))
              .kind());
      assertEquals(
          ErrorKind.SERIALIZATION,
          classifier.classify(new SQLException("deadlock detected")).kind());
      assertEquals(
          ErrorKind.CONNECTION_LOSS,
          classifier.classify(new SQLException("Connection reset by peer")).kind());
    }

    @Test
    @DisplayName("Should classify I/O failures by message")
    void shouldClassifyIoException() {
      assertEquals(
          ErrorKind.CONNECTION_LOSS,
          classifier.classify(new ConnectException("Connection refused")).kind());
      assertEquals(ErrorKind.UNKNOWN, classifier.classify(new IOException("disk full")).kind());
    }

    @Test
    @DisplayName("Should classify interruption and cancellation as timeout")
    void shouldClassifyInterruption() {
      assertEquals(ErrorKind.TIMEOUT, classifier.classify(new InterruptedException()).kind());
      assertEquals(ErrorKind.TIMEOUT, classifier.classify(new CancellationException()).kind());
    }

    @Test
    @DisplayName("Should fail closed on unrecognized errors")
    void shouldFailClosed() {
      final var classified = classifier.classify(new IllegalStateException("bug"));
      assertEquals(ErrorKind.UNKNOWN, classified.kind());
      assertFalse(classified.retryable());
      assertFalse(classifier.classify(null).retryable());
    }
  }

  @Nested
  @DisplayName("Cause chains")
  class CauseChains {

    @Test
    @DisplayName("Should find SQLState in a wrapped cause and keep the original error")
    void shouldWalkCauseChain() {
      final var root = new SQLException("could not serialize", "40001");
      final var wrapped = new RuntimeException("dao failure", new IllegalStateException(root));

      final var classified = classifier.classify(wrapped);

      assertEquals(ErrorKind.SERIALIZATION, classified.kind());
      assertSame(wrapped, classified.cause());
    }

    @Test
    @DisplayName("Should follow chained next exceptions")
    void shouldWalkNextExceptions() {
      final var batch = new BatchUpdateException("Batch entry 0 was aborted", null, new int[0]);
      batch.setNextException(new SQLException("serialization failure", "40001"));

      assertEquals(ErrorKind.SERIALIZATION, classifier.classify(batch).kind());
    }

    @Test
    @DisplayName("Should terminate on cyclic cause chains")
    void shouldHandleCycles() {
      final var first = new SQLException("first");
      final var second = new SQLException("second", first);
      first.initCause(second);

      assertEquals(ErrorKind.UNKNOWN, classifier.classify(first).kind());
    }
  }
}
