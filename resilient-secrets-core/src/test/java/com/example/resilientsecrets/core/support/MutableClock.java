package com.example.resilientsecrets.core.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Clock that only moves when a test advances it. */
public final class MutableClock extends Clock {

  private volatile Instant now;

  public MutableClock(final Instant start) {
    this.now = start;
  }

  public static MutableClock startingAt(final String instant) {
    return new MutableClock(Instant.parse(instant));
  }

  public void advance(final Duration duration) {
    now = now.plus(duration);
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(final ZoneId zone) {
    return this;
  }

  @Override
  public Instant instant() {
    return now;
  }
}
