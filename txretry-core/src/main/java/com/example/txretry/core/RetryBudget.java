package com.example.txretry.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits for one {@link RetryExecutor#run} call.
 *
 * @param maxAttempts maximum number of attempts including the first, must be >= 1
 * @param maxElapsed wall-clock limit for the whole run, must be > 0
 * @param policy backoff applied between attempts
 */
public record RetryBudget(int maxAttempts, Duration maxElapsed, BackoffPolicy policy) {

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final Duration DEFAULT_MAX_ELAPSED = Duration.ofSeconds(30);
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(50);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
  public static final double DEFAULT_JITTER_FACTOR = 0.5;

  public RetryBudget {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    Objects.requireNonNull(maxElapsed, "maxElapsed");
    if (maxElapsed.isNegative() || maxElapsed.isZero())
      throw new IllegalArgumentException("maxElapsed must be > 0");
    Objects.requireNonNull(policy, "policy");
  }

  /**
   * Default budget: 5 attempts within 30 seconds, exponential backoff from 50ms to 5s with 50%
   * jitter.
   *
   * @return default budget
   */
  public static RetryBudget defaults() {
    return new RetryBudget(
        DEFAULT_MAX_ATTEMPTS,
        DEFAULT_MAX_ELAPSED,
        BackoffPolicy.exponential(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_JITTER_FACTOR));
  }

  /**
   * Budget that never retries.
   *
   * @return single-attempt budget
   */
  public static RetryBudget singleAttempt() {
    return new RetryBudget(1, DEFAULT_MAX_ELAPSED, BackoffPolicy.none());
  }

  /**
   * Copy with a different attempt limit.
   *
   * @param attempts maximum attempts
   * @return new budget
   */
  public RetryBudget withMaxAttempts(final int attempts) {
    return new RetryBudget(attempts, maxElapsed, policy);
  }

  /**
   * Copy with a different elapsed-time limit.
   *
   * @param elapsed maximum elapsed time
   * @return new budget
   */
  public RetryBudget withMaxElapsed(final Duration elapsed) {
    return new RetryBudget(maxAttempts, elapsed, policy);
  }

  /**
   * Copy with a different backoff policy.
   *
   * @param backoff the policy
   * @return new budget
   */
  public RetryBudget withPolicy(final BackoffPolicy backoff) {
    return new RetryBudget(maxAttempts, maxElapsed, backoff);
  }
}
