package com.example.txretry.core.config;

import com.example.txretry.core.BackoffPolicy;
import com.example.txretry.core.RetryBudget;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

/**
 * Externalized retry configuration, usually read from JSON by {@link RetrySettingsLoader}.
 *
 * <pre>{@code
 * {
 *   "maxAttempts": 8,
 *   "baseDelayMillis": 20,
 *   "maxDelayMillis": 2000,
 *   "jitterFactor": 0.5,
 *   "maxElapsedMillis": 15000
 * }
 * }</pre>
 *
 * <p>Missing fields take the {@link RetryBudget#defaults()} values; unknown fields are ignored.
 *
 * @param maxAttempts maximum attempts including the first
 * @param baseDelayMillis delay after the first failed attempt
 * @param maxDelayMillis cap for any delay
 * @param jitterFactor spread of the random delay factor, in [0, 1]
 * @param maxElapsedMillis wall-clock limit for one run
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrySettings(
    Integer maxAttempts,
    Long baseDelayMillis,
    Long maxDelayMillis,
    Double jitterFactor,
    Long maxElapsedMillis) {

  public RetrySettings {
    if (maxAttempts == null) maxAttempts = RetryBudget.DEFAULT_MAX_ATTEMPTS;
    if (baseDelayMillis == null) baseDelayMillis = RetryBudget.DEFAULT_BASE_DELAY.toMillis();
    if (maxDelayMillis == null) maxDelayMillis = RetryBudget.DEFAULT_MAX_DELAY.toMillis();
    if (jitterFactor == null) jitterFactor = RetryBudget.DEFAULT_JITTER_FACTOR;
    if (maxElapsedMillis == null) maxElapsedMillis = RetryBudget.DEFAULT_MAX_ELAPSED.toMillis();
  }

  public static RetrySettings defaults() {
    return new RetrySettings(null, null, null, null, null);
  }

  /**
   * Builds the budget described by these settings.
   *
   * @return retry budget with exponential backoff
   * @throws IllegalArgumentException if a value is out of range
   */
  public RetryBudget toBudget() {
    return new RetryBudget(
        maxAttempts,
        Duration.ofMillis(maxElapsedMillis),
        BackoffPolicy.exponential(
            Duration.ofMillis(baseDelayMillis), Duration.ofMillis(maxDelayMillis), jitterFactor));
  }
}
