package com.example.txretry.core;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned signal that stops a {@link RetryExecutor#run} call.
 *
 * <p>The executor checks the token before every attempt and waits on it during backoff, so a
 * cancel issued while the executor sleeps wakes it immediately.
 *
 * <pre>{@code
 * final var token = new CancellationToken();
 * final var future = pool.submit(() -> executor.run(work, budget, token));
 * // later, from another thread
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken {

  private final CountDownLatch latch = new CountDownLatch(1);

  /**
   * Returns a fresh token nobody holds a reference to, so it is never cancelled.
   *
   * @return inert token
   */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  /** Signals cancellation. Idempotent. */
  public void cancel() {
    latch.countDown();
  }

  /** Whether {@link #cancel()} has been called. */
  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Waits up to {@code timeout} for cancellation.
   *
   * @param timeout how long to wait
   * @return true if the token was cancelled before the timeout elapsed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean awaitCancellation(final Duration timeout) throws InterruptedException {
    if (timeout.isZero() || timeout.isNegative()) return isCancelled();
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
