package com.example.resilientsecrets.core.pool;

import java.time.Duration;

/**
 * Point-in-time snapshot of pool counters. Counters cover the lifetime of one pool instance.
 *
 * @param size fixed pool size
 * @param borrowed handles currently borrowed
 * @param peakBorrowed highest number of concurrently borrowed handles
 * @param idle clients currently idle in the pool
 * @param borrows successful acquisitions
 * @param returns releases (duplicate releases are not counted)
 * @param timeouts acquisitions that timed out
 * @param created clients opened by the factory
 * @param discarded clients closed by the pool (dead, invalidated, or closed with the pool)
 * @param totalWait cumulative time callers spent waiting in {@code acquire}
 */
public record PoolStatistics(
    int size,
    int borrowed,
    int peakBorrowed,
    int idle,
    long borrows,
    long returns,
    long timeouts,
    long created,
    long discarded,
    Duration totalWait) {

  /**
   * Mean wait per acquisition attempt.
   *
   * @return average wait, zero when nothing was acquired yet
   */
  public Duration averageWait() {
    final var attempts = borrows + timeouts;
    return attempts == 0 ? Duration.ZERO : totalWait.dividedBy(attempts);
  }
}
