package com.example.txretry.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter.
 *
 * <pre>
 * raw   = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay = min(raw * uniform[1 - jitterFactor, 1 + jitterFactor], maxDelay)
 * </pre>
 *
 * <p>With {@code baseDelay=100ms, maxDelay=2s, jitterFactor=0.5}:
 *
 * <ul>
 *   <li>attempt 1: 50-150ms
 *   <li>attempt 2: 100-300ms
 *   <li>attempt 3: 200-600ms
 *   <li>attempt 6: 1-2s (capped)
 * </ul>
 */
public final class ExponentialBackoff implements BackoffPolicy {

  private final Duration baseDelay;
  private final Duration maxDelay;
  private final double jitterFactor;
  private final DoubleSupplier random;

  /**
   * Creates a policy drawing jitter from {@link ThreadLocalRandom}.
   *
   * @param baseDelay delay after the first failed attempt, must be > 0
   * @param maxDelay cap for every delay, must be >= baseDelay
   * @param jitterFactor spread of the random factor, in [0, 1]
   */
  public ExponentialBackoff(
      final Duration baseDelay, final Duration maxDelay, final double jitterFactor) {
    this(baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
  }

  ExponentialBackoff(
      final Duration baseDelay,
      final Duration maxDelay,
      final double jitterFactor,
      final DoubleSupplier random) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || baseDelay.isZero())
      throw new IllegalArgumentException("baseDelay must be > 0");
    if (maxDelay.compareTo(baseDelay) < 0)
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    if (jitterFactor < 0.0 || jitterFactor > 1.0)
      throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.jitterFactor = jitterFactor;
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public Duration delay(final int attemptNumber) {
    if (attemptNumber < 1) throw new IllegalArgumentException("attemptNumber must be >= 1");

    final var maxNanos = maxDelay.toNanos();
    // 2^62 already exceeds any Duration we can express in nanos
    final var shift = Math.min(attemptNumber - 1, 62);
    final var base = baseDelay.toNanos();
    final var raw = base > (maxNanos >> shift) ? maxNanos : Math.min(base << shift, maxNanos);

    if (jitterFactor == 0.0) return Duration.ofNanos(raw);

    final var factor = 1.0 - jitterFactor + 2.0 * jitterFactor * random.getAsDouble();
    final var jittered = (long) Math.min(raw * factor, (double) maxNanos);
    return Duration.ofNanos(Math.max(0L, jittered));
  }

  public Duration baseDelay() {
    return baseDelay;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public double jitterFactor() {
    return jitterFactor;
  }

  @Override
  public String toString() {
    return "ExponentialBackoff[base="
        + baseDelay
        + ", max="
        + maxDelay
        + ", jitter="
        + jitterFactor
        + "]";
  }
}
