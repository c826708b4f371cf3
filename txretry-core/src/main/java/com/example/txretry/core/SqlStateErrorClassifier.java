package com.example.txretry.core;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Default {@link ErrorClassifier} based on SQLState codes, JDBC exception subclasses and a short
 * list of driver message keywords.
 *
 * <p>The whole cause chain is inspected, including {@link SQLException#getNextException()} chains.
 * The outermost failure with a recognized code decides.
 *
 * <ul>
 *   <li>40001, 40P01, 40000 and the rest of class 40: {@link ErrorKind#SERIALIZATION}
 *   <li>40002 (integrity violation at commit): {@link ErrorKind#CONSTRAINT_VIOLATION}
 *   <li>40003 (statement completion unknown): {@link ErrorKind#UNKNOWN}
 *   <li>class 08, 57P01, 57P02, 57P03: {@link ErrorKind#CONNECTION_LOSS}
 *   <li>class 23: {@link ErrorKind#CONSTRAINT_VIOLATION}
 *   <li>57014 (query canceled), {@link SQLTimeoutException}, interruption: {@link
 *       ErrorKind#TIMEOUT}
 * </ul>
 */
public final class SqlStateErrorClassifier implements ErrorClassifier {

  static final SqlStateErrorClassifier INSTANCE = new SqlStateErrorClassifier();

  private static final String[] SERIALIZATION_KEYWORDS = {
    "restart transaction", "could not serialize access", "deadlock detected"
  };

  private static final String[] CONNECTION_KEYWORDS = {
    "connection refused", "connection reset", "broken pipe", "socket closed", "i/o error"
  };

  private SqlStateErrorClassifier() {}

  @Override
  public ClassifiedError classify(final Throwable error) {
    if (error == null) return ClassifiedError.unknown(null);

    final Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable cur = error;
    while (cur != null && seen.add(cur)) {
      final var kind = kindOf(cur);
      if (kind != null) return ClassifiedError.of(kind, error);

      if (cur instanceof SQLException sql) {
        var next = sql.getNextException();
        while (next != null && seen.add(next)) {
          final var nextKind = kindOf(next);
          if (nextKind != null) return ClassifiedError.of(nextKind, error);
          next = next.getNextException();
        }
      }
      cur = cur.getCause();
    }
    return ClassifiedError.unknown(error);
  }

  /**
   * Maps a SQLState to a kind.
   *
   * @param sqlState the five character SQLState, may be null
   * @return the kind, or null if the state says nothing about retryability
   */
  public static ErrorKind kindForSqlState(final String sqlState) {
    if (sqlState == null || sqlState.length() < 2) return null;

    switch (sqlState) {
      case "40002":
        return ErrorKind.CONSTRAINT_VIOLATION;
      case "40003":
        return ErrorKind.UNKNOWN;
      case "57014":
        return ErrorKind.TIMEOUT;
      case "57P01":
      case "57P02":
      case "57P03":
        return ErrorKind.CONNECTION_LOSS;
      default:
        break;
    }

    final var sqlClass = sqlState.substring(0, 2);
    switch (sqlClass) {
      case "40":
        return ErrorKind.SERIALIZATION;
      case "08":
        return ErrorKind.CONNECTION_LOSS;
      case "23":
        return ErrorKind.CONSTRAINT_VIOLATION;
      default:
        return null;
    }
  }

  /**
   * Maps well-known driver messages to a kind.
   *
   * @param message the failure message, may be null
   * @return the kind, or null if no keyword matches
   */
  public static ErrorKind kindForMessage(final String message) {
    if (message == null) return null;

    final var lower = message.toLowerCase(Locale.ROOT);
    for (final var keyword : SERIALIZATION_KEYWORDS)
      if (lower.contains(keyword)) return ErrorKind.SERIALIZATION;
    for (final var keyword : CONNECTION_KEYWORDS)
      if (lower.contains(keyword)) return ErrorKind.CONNECTION_LOSS;
    return null;
  }

  private static ErrorKind kindOf(final Throwable t) {
    if (t instanceof InterruptedException
        || t instanceof CancellationException
        || t instanceof SQLTimeoutException) return ErrorKind.TIMEOUT;

    if (t instanceof SQLException sql) {
      final var byState = kindForSqlState(sql.getSQLState());
      if (byState != null) return byState;
      if (sql instanceof SQLTransactionRollbackException) return ErrorKind.SERIALIZATION;
      if (sql instanceof SQLIntegrityConstraintViolationException)
        return ErrorKind.CONSTRAINT_VIOLATION;
      if (sql instanceof SQLTransientConnectionException || sql instanceof SQLRecoverableException)
        return ErrorKind.CONNECTION_LOSS;
      return kindForMessage(sql.getMessage());
    }

    if (t instanceof IOException) return kindForMessage(t.getMessage());
    return null;
  }
}
