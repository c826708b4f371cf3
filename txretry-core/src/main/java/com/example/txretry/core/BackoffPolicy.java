package com.example.txretry.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes how long to wait before the next attempt.
 *
 * <p>Implementations hold no per-run state, so one instance can be shared across executors and
 * threads.
 */
@FunctionalInterface
public interface BackoffPolicy {

  /**
   * Returns the delay to apply after a failed attempt.
   *
   * @param attemptNumber number of the attempt that just failed, 1-based
   * @return non-negative delay
   */
  Duration delay(int attemptNumber);

  /**
   * Exponential backoff with jitter.
   *
   * @param baseDelay delay after the first failed attempt
   * @param maxDelay upper bound for any delay
   * @param jitterFactor spread of the random factor, in [0, 1]
   * @return exponential policy
   * @see ExponentialBackoff
   */
  static BackoffPolicy exponential(
      final Duration baseDelay, final Duration maxDelay, final double jitterFactor) {
    return new ExponentialBackoff(baseDelay, maxDelay, jitterFactor);
  }

  /**
   * Same delay after every failed attempt.
   *
   * @param delay the delay
   * @return fixed policy
   */
  static BackoffPolicy fixed(final Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
    return attempt -> delay;
  }

  /**
   * Retries immediately.
   *
   * @return zero-delay policy
   */
  static BackoffPolicy none() {
    return attempt -> Duration.ZERO;
  }
}
