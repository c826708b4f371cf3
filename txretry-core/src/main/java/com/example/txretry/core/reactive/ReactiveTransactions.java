package com.example.txretry.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.txretry.core.AttemptListener;
import com.example.txretry.core.AttemptRecord;
import com.example.txretry.core.ClassifiedError;
import com.example.txretry.core.ErrorClassifier;
import com.example.txretry.core.ErrorKind;
import com.example.txretry.core.RetriesExhaustedException;
import com.example.txretry.core.RetryBudget;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Reactive counterpart of {@link com.example.txretry.core.RetryExecutor} for R2DBC.
 *
 * <h2>Retrying an Existing Pipeline</h2>
 *
 * <pre>{@code
 * Mono.from(connectionFactory.create())
 *     .flatMap(conn -> ...)
 *     .retryWhen(ReactiveTransactions.retrySpec(RetryBudget.defaults(),
 *         R2dbcErrorClassifier.instance()));
 * }</pre>
 *
 * <h2>Running a Transaction</h2>
 *
 * <pre>{@code
 * Mono<Long> count = ReactiveTransactions.inTransaction(
 *     connectionFactory,
 *     conn -> Mono.from(conn.createStatement("SELECT count(*) FROM shopping_lists").execute())
 *         .flatMap(result -> Mono.from(result.map((row, meta) -> row.get(0, Long.class)))),
 *     RetryBudget.defaults());
 * }</pre>
 */
public final class ReactiveTransactions {

  private static final Logger LOGGER = System.getLogger(ReactiveTransactions.class.getName());

  private ReactiveTransactions() {}

  /**
   * Builds a Reactor retry spec honoring {@code budget}.
   *
   * <p>Non-retryable failures are propagated unchanged. Running out of attempts or time raises
   * {@link RetriesExhaustedException}. The backoff never extends past the elapsed budget.
   *
   * @param budget attempt, time and backoff limits
   * @param classifier decides which failures are retried
   * @return retry spec for {@code retryWhen}
   */
  public static Retry retrySpec(final RetryBudget budget, final ErrorClassifier classifier) {
    return retrySpec(budget, classifier, AttemptListener.none(), Clock.systemUTC());
  }

  static Retry retrySpec(
      final RetryBudget budget,
      final ErrorClassifier classifier,
      final AttemptListener listener,
      final Clock clock) {
    Objects.requireNonNull(budget, "budget");
    Objects.requireNonNull(classifier, "classifier");
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(clock, "clock");

    return Retry.from(
        signals -> {
          final var startedAt = clock.instant();
          final var attemptStartedAt = new AtomicReference<>(startedAt);
          final List<AttemptRecord> attempts = new ArrayList<>();

          return signals.concatMap(
              signal -> {
                final var attemptNumber = attempts.size() + 1;
                final var failure = classifier.classify(signal.failure());
                final var elapsed = Duration.between(startedAt, clock.instant());

                if (!failure.retryable()) {
                  record(attempts, listener, attemptNumber, attemptStartedAt.get(), failure, false);
                  return Mono.error(signal.failure());
                }
                record(attempts, listener, attemptNumber, attemptStartedAt.get(), failure, true);

                if (attemptNumber >= budget.maxAttempts()) {
                  LOGGER.log(WARNING, "All {0} transaction attempts failed", attemptNumber);
                  return Mono.error(new RetriesExhaustedException(failure, attempts, elapsed));
                }

                if (elapsed.compareTo(budget.maxElapsed()) >= 0) {
                  LOGGER.log(
                      WARNING,
                      "Transaction retry budget of {0} ms spent after attempt {1}",
                      budget.maxElapsed().toMillis(),
                      attemptNumber);
                  return Mono.error(new RetriesExhaustedException(failure, attempts, elapsed));
                }

                final var remaining = budget.maxElapsed().minus(elapsed);
                final var backoff = budget.policy().delay(attemptNumber);
                final var delay = backoff.compareTo(remaining) <= 0 ? backoff : remaining;

                LOGGER.log(
                    DEBUG,
                    "{0} on attempt {1}, retrying in {2} ms",
                    failure.kind(),
                    attemptNumber,
                    delay.toMillis());
                return Mono.delay(delay)
                    .doOnNext(tick -> attemptStartedAt.set(clock.instant()))
                    .thenReturn(attemptNumber);
              });
        });
  }

  /**
   * Runs {@code work} in a transaction on a fresh connection, replaying it with the R2DBC
   * classifier.
   *
   * @param connectionFactory where connections come from
   * @param work the unit of work; may be subscribed more than once
   * @param budget attempt, time and backoff limits
   * @param <T> result type
   * @return the result of the committed attempt
   */
  public static <T> Mono<T> inTransaction(
      final ConnectionFactory connectionFactory,
      final Function<Connection, ? extends Publisher<T>> work,
      final RetryBudget budget) {
    return inTransaction(connectionFactory, work, budget, R2dbcErrorClassifier.instance());
  }

  /**
   * Runs {@code work} in a transaction on a fresh connection per attempt.
   *
   * <p>The transaction is committed after {@code work} completes, rolled back on error or
   * cancellation, and the connection is closed in every case. A connection loss during commit is
   * surfaced as non-retryable because the commit may have been applied.
   *
   * @param connectionFactory where connections come from
   * @param work the unit of work; may be subscribed more than once
   * @param budget attempt, time and backoff limits
   * @param classifier decides which failures are retried
   * @param <T> result type
   * @return the result of the committed attempt
   */
  public static <T> Mono<T> inTransaction(
      final ConnectionFactory connectionFactory,
      final Function<Connection, ? extends Publisher<T>> work,
      final RetryBudget budget,
      final ErrorClassifier classifier) {
    Objects.requireNonNull(connectionFactory, "connectionFactory");
    Objects.requireNonNull(work, "work");

    return Mono.usingWhen(
            Mono.defer(() -> Mono.<Connection>from(connectionFactory.create())),
            conn ->
                Mono.from(conn.beginTransaction())
                    .then(Mono.<T>from(work.apply(conn)))
                    .flatMap(value -> commit(conn, classifier).thenReturn(value))
                    .switchIfEmpty(
                        Mono.defer(() -> commit(conn, classifier).then(Mono.<T>empty()))),
            conn -> Mono.defer(() -> Mono.from(conn.close())),
            (conn, error) -> rollbackAndClose(conn),
            ReactiveTransactions::rollbackAndClose)
        .retryWhen(retrySpec(budget, classifier));
  }

  private static Mono<Void> commit(final Connection conn, final ErrorClassifier classifier) {
    return Mono.from(conn.commitTransaction())
        .onErrorMap(
            e -> classifier.classify(e).kind() == ErrorKind.CONNECTION_LOSS,
            e -> new R2dbcNonTransientResourceException("Commit outcome unknown", "40003", 0, e));
  }

  private static Mono<Void> rollbackAndClose(final Connection conn) {
    return Mono.from(conn.rollbackTransaction())
        .onErrorResume(
            e -> {
              LOGGER.log(WARNING, "Failed to roll back R2DBC transaction", e);
              return Mono.empty();
            })
        .then(Mono.defer(() -> Mono.from(conn.close())));
  }

  private static void record(
      final List<AttemptRecord> attempts,
      final AttemptListener listener,
      final int attemptNumber,
      final Instant startedAt,
      final ClassifiedError failure,
      final boolean retryable) {
    final var outcome = retryable ? AttemptRecord.Outcome.RETRYABLE : AttemptRecord.Outcome.FATAL;
    final var attemptRecord = new AttemptRecord(attemptNumber, startedAt, outcome, failure);
    attempts.add(attemptRecord);
    try {
      listener.onAttempt(attemptRecord);
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Attempt listener failed on attempt " + attemptNumber, e);
    }
  }
}
