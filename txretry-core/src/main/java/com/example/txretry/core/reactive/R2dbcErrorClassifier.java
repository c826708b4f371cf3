package com.example.txretry.core.reactive;

import com.example.txretry.core.ClassifiedError;
import com.example.txretry.core.ErrorClassifier;
import com.example.txretry.core.ErrorKind;
import com.example.txretry.core.SqlStateErrorClassifier;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcRollbackException;
import io.r2dbc.spi.R2dbcTimeoutException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * {@link ErrorClassifier} for R2DBC drivers, mirroring {@link SqlStateErrorClassifier} for JDBC.
 *
 * <ul>
 *   <li>SQLState first, using the same table as the JDBC classifier
 *   <li>then the exception type: {@link R2dbcRollbackException} is a serialization conflict,
 *       {@link R2dbcTransientResourceException} a connection loss, {@link
 *       R2dbcDataIntegrityViolationException} a constraint violation, {@link R2dbcTimeoutException}
 *       a timeout
 *   <li>then driver message keywords
 * </ul>
 *
 * <pre>{@code
 * reactor.util.retry.Retry spec =
 *     ReactiveTransactions.retrySpec(RetryBudget.defaults(), R2dbcErrorClassifier.instance());
 * }</pre>
 */
public final class R2dbcErrorClassifier implements ErrorClassifier {

  private static final R2dbcErrorClassifier INSTANCE = new R2dbcErrorClassifier();

  private R2dbcErrorClassifier() {}

  public static R2dbcErrorClassifier instance() {
    return INSTANCE;
  }

  @Override
  public ClassifiedError classify(final Throwable error) {
    final Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable cur = error;
    while (cur != null && seen.add(cur)) {
      final var kind = kindOf(cur);
      if (kind != null) return ClassifiedError.of(kind, error);
      cur = cur.getCause();
    }
    return ClassifiedError.unknown(error);
  }

  private static ErrorKind kindOf(final Throwable t) {
    if (t instanceof InterruptedException || t instanceof CancellationException)
      return ErrorKind.TIMEOUT;
    if (!(t instanceof R2dbcException r2dbcEx)) return null;

    final var byState = SqlStateErrorClassifier.kindForSqlState(r2dbcEx.getSqlState());
    if (byState != null) return byState;

    if (r2dbcEx instanceof R2dbcRollbackException) return ErrorKind.SERIALIZATION;
    if (r2dbcEx instanceof R2dbcTransientResourceException) return ErrorKind.CONNECTION_LOSS;
    if (r2dbcEx instanceof R2dbcDataIntegrityViolationException)
      return ErrorKind.CONSTRAINT_VIOLATION;
    if (r2dbcEx instanceof R2dbcTimeoutException) return ErrorKind.TIMEOUT;

    return SqlStateErrorClassifier.kindForMessage(r2dbcEx.getMessage());
  }
}
