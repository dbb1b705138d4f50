package com.example.resilientsecrets.core.version;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.StoreAccessException;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion scoped to a string key. Entries exist only while a key is in use, so unrelated
 * keys never contend and the map does not grow with the number of versions ever touched.
 */
final class KeyedLocks {

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Duration timeout;

  KeyedLocks(final Duration timeout) {
    this.timeout = timeout;
  }

  <T> T withLock(final String key, final Supplier<T> body) {
    final var entry =
        entries.compute(
            key,
            (k, existing) -> {
              final var held = existing == null ? new Entry() : existing;
              held.users++;
              return held;
            });
    try {
      if (!entry.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS))
        throw new StoreAccessException(
            ErrorKind.UNAVAILABLE, "Timed out waiting for a concurrent change to " + key);
      try {
        return body.get();
      } finally {
        entry.lock.unlock();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreAccessException(ErrorKind.UNKNOWN, "Interrupted while locking " + key, e);
    } finally {
      entries.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
    }
  }

  int activeKeys() {
    return entries.size();
  }

  private static final class Entry {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }
}
