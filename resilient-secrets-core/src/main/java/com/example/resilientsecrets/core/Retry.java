package com.example.resilientsecrets.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientsecrets.core.error.StoreAccessException;
import java.util.function.Supplier;

/**
 * Bounded retry for transient store failures.
 *
 * <p>Only failures whose {@link com.example.resilientsecrets.core.error.ErrorKind} is retryable
 * ({@code UNAVAILABLE}, {@code POOL_TIMEOUT}) are retried; every other failure propagates on first
 * occurrence.
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Retry policy configuration supporting exponential backoff.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param initialDelayMillis delay before the first retry in milliseconds, must be >= 0
   * @param maxDelayMillis maximum delay cap for exponential backoff, must be >= initialDelayMillis
   * @param backoffMultiplier multiplier for exponential backoff (1.0 = fixed delay), must be >= 1.0
   * @param jitter whether to add random jitter (up to 25%) to delays
   */
  public record Policy(
      int maxAttempts,
      long initialDelayMillis,
      long maxDelayMillis,
      double backoffMultiplier,
      boolean jitter) {

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (initialDelayMillis < 0)
        throw new IllegalArgumentException("initialDelayMillis must be >= 0");
      if (maxDelayMillis < initialDelayMillis)
        throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
      if (backoffMultiplier < 1.0)
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /**
     * Creates a fixed delay retry policy.
     *
     * @param attempts number of attempts (including first)
     * @param delayMillis delay between attempts in milliseconds
     * @return fixed delay retry policy
     */
    public static Policy fixed(final int attempts, final long delayMillis) {
      return new Policy(attempts, delayMillis, delayMillis, 1.0, false);
    }

    /**
     * Creates an exponential backoff retry policy with jitter.
     *
     * <p>Delays double from {@code initialDelay} up to a maximum of 5 seconds, with 25% random
     * jitter.
     *
     * @param attempts number of attempts (including first)
     * @param initialDelay delay before the first retry in milliseconds
     * @return exponential backoff retry policy with jitter
     */
    public static Policy exponential(final int attempts, final long initialDelay) {
      return new Policy(attempts, initialDelay, Math.max(initialDelay, 5_000L), 2.0, true);
    }

    /**
     * Creates a policy that never retries.
     *
     * @return single-attempt policy
     */
    public static Policy none() {
      return fixed(1, 0L);
    }

    /**
     * Calculates the delay to wait before a given attempt.
     *
     * @param attempt upcoming attempt number (1-based)
     * @return delay in milliseconds, zero for the first attempt
     */
    long calculateDelay(final int attempt) {
      if (attempt <= 1) return 0L;

      var delay = initialDelayMillis;
      if (backoffMultiplier > 1.0) {
        delay = (long) (initialDelayMillis * Math.pow(backoffMultiplier, attempt - 2));
        delay = Math.min(delay, maxDelayMillis);
      }

      if (jitter) {
        final var jitterAmount = (long) (delay * 0.25 * Math.random());
        delay += jitterAmount;
      }

      return delay;
    }
  }

  /**
   * Runs {@code op}, retrying retryable {@link StoreAccessException}s according to {@code policy}.
   *
   * @param op operation to execute
   * @param policy retry policy configuration
   * @param description operation description used in log messages
   * @param <T> result type
   * @return operation result
   * @throws StoreAccessException the last failure if attempts are exhausted, or the first
   *     non-retryable failure
   */
  public static <T> T onRetryable(
      final Supplier<? extends T> op, final Policy policy, final String description) {
    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return op.get();
      } catch (final StoreAccessException e) {
        if (!e.isRetryable()) throw e;

        if (attempt >= policy.maxAttempts()) {
          if (policy.maxAttempts() > 1)
            LOGGER.log(WARNING, "All {0} attempts of {1} failed", attempt, description);
          throw e;
        }

        LOGGER.log(
            DEBUG, "{0} failed on attempt {1} ({2}), retrying", description, attempt, e.kind());

        final var delay = policy.calculateDelay(attempt + 1);
        if (delay > 0) {
          try {
            Thread.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }
      }
    }
  }
}
