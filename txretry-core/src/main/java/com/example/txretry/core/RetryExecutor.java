package com.example.txretry.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a {@link UnitOfWork} in a transaction and replays it on transient conflicts until it
 * commits, fails with a non-retryable error, is cancelled, or exhausts its {@link RetryBudget}.
 *
 * <p>The executor keeps no mutable state between calls: every {@code run} owns its attempt
 * counter, its scope and its timer, so one instance can be shared by any number of threads.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var executor = new RetryExecutor<>(DataSourceScopeFactory.cockroach(dataSource),
 *     RetryBudget.defaults());
 *
 * long id = executor.run(scope -> {
 *     try (var ps = scope.connection().prepareStatement("INSERT ... RETURNING id")) {
 *         ...
 *     }
 * });
 * }</pre>
 *
 * <h2>Full Configuration</h2>
 *
 * <pre>{@code
 * var executor = RetryExecutor.builder(scopeFactory)
 *     .budget(new RetryBudget(8, Duration.ofSeconds(10),
 *         BackoffPolicy.exponential(Duration.ofMillis(20), Duration.ofSeconds(1), 0.5)))
 *     .classifier(vendorClassifier.orElse(ErrorClassifier.defaultClassifier()))
 *     .attemptListener(record -> metrics.record(record))
 *     .build();
 * }</pre>
 *
 * @param <S> scope type handed to the unit of work
 */
public final class RetryExecutor<S extends TransactionScope> {

  private static final Logger LOGGER = System.getLogger(RetryExecutor.class.getName());

  private final ScopeFactory<S> scopeFactory;
  private final RetryBudget defaultBudget;
  private final ErrorClassifier classifier;
  private final AttemptListener attemptListener;
  private final Clock clock;

  /**
   * Creates an executor with the default classifier.
   *
   * @param scopeFactory opens one scope per attempt
   * @param defaultBudget budget used by {@link #run(UnitOfWork)}
   */
  public RetryExecutor(final ScopeFactory<S> scopeFactory, final RetryBudget defaultBudget) {
    this(
        scopeFactory,
        defaultBudget,
        ErrorClassifier.defaultClassifier(),
        AttemptListener.none(),
        Clock.systemUTC());
  }

  private RetryExecutor(
      final ScopeFactory<S> scopeFactory,
      final RetryBudget defaultBudget,
      final ErrorClassifier classifier,
      final AttemptListener attemptListener,
      final Clock clock) {
    this.scopeFactory = Objects.requireNonNull(scopeFactory, "scopeFactory");
    this.defaultBudget = Objects.requireNonNull(defaultBudget, "defaultBudget");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.attemptListener = Objects.requireNonNull(attemptListener, "attemptListener");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a new builder.
   *
   * @param scopeFactory opens one scope per attempt
   * @param <S> scope type
   * @return new builder
   */
  public static <S extends TransactionScope> Builder<S> builder(
      final ScopeFactory<S> scopeFactory) {
    return new Builder<>(scopeFactory);
  }

  /**
   * Builder for {@link RetryExecutor}.
   *
   * @param <S> scope type
   */
  public static final class Builder<S extends TransactionScope> {
    private final ScopeFactory<S> scopeFactory;
    private RetryBudget budget = RetryBudget.defaults();
    private ErrorClassifier classifier = ErrorClassifier.defaultClassifier();
    private AttemptListener attemptListener = AttemptListener.none();
    private Clock clock = Clock.systemUTC();

    private Builder(final ScopeFactory<S> scopeFactory) {
      this.scopeFactory = scopeFactory;
    }

    /**
     * Sets the default budget.
     *
     * <p>Default: {@link RetryBudget#defaults()}
     *
     * @param budget the budget
     * @return this builder
     */
    public Builder<S> budget(final RetryBudget budget) {
      this.budget = budget;
      return this;
    }

    /**
     * Sets the error classifier.
     *
     * <p>Default: {@link ErrorClassifier#defaultClassifier()}
     *
     * @param classifier the classifier
     * @return this builder
     */
    public Builder<S> classifier(final ErrorClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets a listener notified after every attempt. Exceptions thrown by the listener are logged
     * and do not change the outcome of the run.
     *
     * @param attemptListener the listener
     * @return this builder
     */
    public Builder<S> attemptListener(final AttemptListener attemptListener) {
      this.attemptListener = attemptListener;
      return this;
    }

    /**
     * Sets the clock used for attempt timestamps and the elapsed-time budget.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder<S> clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the executor.
     *
     * @return configured executor
     * @throws IllegalStateException if a required setting is missing
     */
    public RetryExecutor<S> build() {
      if (scopeFactory == null) throw new IllegalStateException("scopeFactory is required");
      if (budget == null) throw new IllegalStateException("budget cannot be null");
      if (classifier == null) throw new IllegalStateException("classifier cannot be null");
      if (attemptListener == null)
        throw new IllegalStateException("attemptListener cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      return new RetryExecutor<>(scopeFactory, budget, classifier, attemptListener, clock);
    }
  }

  /** Budget used by {@link #run(UnitOfWork)}. */
  public RetryBudget defaultBudget() {
    return defaultBudget;
  }

  /**
   * Runs {@code work} with the default budget.
   *
   * @param work the unit of work
   * @param <T> result type
   * @return the result of the committed invocation
   * @throws TransactionFailedException if no invocation could be committed
   */
  public <T> T run(final UnitOfWork<S, T> work) throws TransactionFailedException {
    return run(work, defaultBudget, CancellationToken.none());
  }

  /**
   * Runs {@code work} with the given budget.
   *
   * @param work the unit of work
   * @param budget limits for this call
   * @param <T> result type
   * @return the result of the committed invocation
   * @throws TransactionFailedException if no invocation could be committed
   */
  public <T> T run(final UnitOfWork<S, T> work, final RetryBudget budget)
      throws TransactionFailedException {
    return run(work, budget, CancellationToken.none());
  }

  /**
   * Runs {@code work}, replaying it on retryable failures.
   *
   * @param work the unit of work
   * @param budget limits for this call
   * @param token cancels the run from another thread
   * @param <T> result type
   * @return the result of the committed invocation
   * @throws TransactionFailedException on a fatal failure
   * @throws RetriesExhaustedException when the budget runs out
   * @throws TransactionCancelledException when cancelled or interrupted
   */
  public <T> T run(
      final UnitOfWork<S, T> work, final RetryBudget budget, final CancellationToken token)
      throws TransactionFailedException {
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(budget, "budget");
    Objects.requireNonNull(token, "token");

    final var startedAt = clock.instant();
    final List<AttemptRecord> attempts = new ArrayList<>();
    ClassifiedError lastError = null;
    S scope = null;

    try {
      while (true) {
        if (token.isCancelled() || Thread.currentThread().isInterrupted())
          throw new TransactionCancelledException(lastError, attempts, elapsedSince(startedAt));

        final var attemptNumber = attempts.size() + 1;
        final var attemptStartedAt = clock.instant();
        ClassifiedError failure = null;

        if (scope == null) {
          final var opened = openScope();
          scope = opened.scope();
          failure = opened.error();
        }
        if (failure == null) {
          final var result = Attempt.execute(scope, work, classifier);
          if (result.isCommitted()) {
            record(
                attempts, attemptNumber, attemptStartedAt, AttemptRecord.Outcome.COMMITTED, null);
            final var committed = scope;
            scope = null;
            close(committed);
            if (attemptNumber > 1)
              LOGGER.log(DEBUG, "Transaction committed on attempt {0}", attemptNumber);
            return result.value();
          }
          failure = result.error();
        }
        lastError = failure;

        if (token.isCancelled()) {
          record(attempts, attemptNumber, attemptStartedAt, AttemptRecord.Outcome.FATAL, failure);
          throw new TransactionCancelledException(failure, attempts, elapsedSince(startedAt));
        }

        if (!failure.retryable()) {
          record(attempts, attemptNumber, attemptStartedAt, AttemptRecord.Outcome.FATAL, failure);
          throw new TransactionFailedException(
              "Transaction failed", failure, attempts, elapsedSince(startedAt));
        }

        record(attempts, attemptNumber, attemptStartedAt, AttemptRecord.Outcome.RETRYABLE, failure);

        if (attemptNumber >= budget.maxAttempts()) {
          LOGGER.log(WARNING, "All {0} transaction attempts failed", attemptNumber);
          throw new RetriesExhaustedException(failure, attempts, elapsedSince(startedAt));
        }

        final var elapsed = elapsedSince(startedAt);
        if (elapsed.compareTo(budget.maxElapsed()) >= 0) {
          LOGGER.log(
              WARNING,
              "Transaction retry budget of {0} ms spent after attempt {1}",
              budget.maxElapsed().toMillis(),
              attemptNumber);
          throw new RetriesExhaustedException(failure, attempts, elapsed);
        }
        // never sleep past the elapsed budget
        final var delay =
            min(budget.policy().delay(attemptNumber), budget.maxElapsed().minus(elapsed));

        scope = prepareRetry(scope, failure);

        LOGGER.log(
            DEBUG,
            "{0} on attempt {1}, retrying in {2} ms",
            failure.kind(),
            attemptNumber,
            delay.toMillis());

        try {
          if (token.awaitCancellation(delay))
            throw new TransactionCancelledException(failure, attempts, elapsedSince(startedAt));
        } catch (final InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new TransactionCancelledException(failure, attempts, elapsedSince(startedAt));
        }
      }
    } finally {
      if (scope != null) discard(scope);
    }
  }

  /**
   * Opens and begins a scope. Failures are classified like any attempt failure, so a refused
   * connection is retried.
   */
  private Opened<S> openScope() {
    final S opened;
    try {
      opened = scopeFactory.open();
    } catch (final SQLException | RuntimeException e) {
      return new Opened<>(null, classifier.classify(e));
    }
    try {
      opened.begin();
      return new Opened<>(opened, null);
    } catch (final SQLException | RuntimeException e) {
      discard(opened);
      return new Opened<>(null, classifier.classify(e));
    }
  }

  /** Keeps the scope through a restart when possible, otherwise releases it. */
  private S prepareRetry(final S scope, final ClassifiedError failure) {
    if (scope == null) return null;
    if (scope.supportsRestart() && failure.kind() != ErrorKind.CONNECTION_LOSS) {
      try {
        scope.restart();
        return scope;
      } catch (final SQLException | RuntimeException e) {
        LOGGER.log(DEBUG, "Restart failed, opening a new scope: {0}", e.getMessage());
      }
    }
    discard(scope);
    return null;
  }

  private void record(
      final List<AttemptRecord> attempts,
      final int attemptNumber,
      final Instant startedAt,
      final AttemptRecord.Outcome outcome,
      final ClassifiedError error) {
    final var attemptRecord = new AttemptRecord(attemptNumber, startedAt, outcome, error);
    attempts.add(attemptRecord);
    try {
      attemptListener.onAttempt(attemptRecord);
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Attempt listener failed on attempt " + attemptNumber, e);
    }
  }

  private static Duration min(final Duration a, final Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  private Duration elapsedSince(final Instant startedAt) {
    return Duration.between(startedAt, clock.instant());
  }

  private static void discard(final TransactionScope scope) {
    try {
      scope.rollback();
    } catch (final SQLException | RuntimeException e) {
      LOGGER.log(WARNING, "Failed to roll back transaction scope", e);
    }
    close(scope);
  }

  private static void close(final TransactionScope scope) {
    try {
      scope.close();
    } catch (final SQLException | RuntimeException e) {
      LOGGER.log(WARNING, "Failed to close transaction scope", e);
    }
  }

  /** Either a begun scope or the classified reason it could not be opened. */
  private record Opened<S>(S scope, ClassifiedError error) {}
}
