package com.example.resilientsecrets.core.cache;

import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.Version;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * TTL cache of fetched versions keyed by entity and version reference.
 *
 * <p>A zero TTL disables the cache: lookups always load and nothing is stored. Expired entries are
 * evicted when next read. Callers invalidate an entity whenever they mutate it; a load that
 * overlaps an invalidation of its entity is returned to its caller but not cached.
 */
public final class VersionCache {

  private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
  // Invalidation count per entity, keyed by the entity's version key prefix.
  private final ConcurrentHashMap<String, AtomicLong> generations = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  /**
   * @param ttl time to live, zero to disable
   * @param clock time source for expiry
   */
  public VersionCache(final Duration ttl, final Clock clock) {
    if (ttl == null || ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
    if (clock == null) throw new IllegalArgumentException("clock is required");
    this.ttl = ttl;
    this.clock = clock;
  }

  public static VersionCache disabled() {
    return new VersionCache(Duration.ZERO, Clock.systemUTC());
  }

  public boolean isEnabled() {
    return !ttl.isZero();
  }

  /**
   * Returns the cached version if present and not expired.
   *
   * @param entity owning entity
   * @param versionRef version id or alias used for the lookup
   * @return cached version
   */
  public Optional<Version> get(final EntityPath entity, final String versionRef) {
    if (!isEnabled()) return Optional.empty();
    final var key = entity.versionKey(versionRef);
    final var now = clock.millis();
    final var cached = entries.get(key);
    if (cached == null) return Optional.empty();
    if (cached.expiresAtMillis < now) {
      entries.remove(key, cached);
      return Optional.empty();
    }
    return Optional.of(cached.version);
  }

  public void put(final EntityPath entity, final String versionRef, final Version version) {
    if (!isEnabled()) return;
    entries.put(
        entity.versionKey(versionRef), new CacheEntry(version, clock.millis() + ttl.toMillis()));
  }

  /**
   * Returns the cached version or loads and caches it.
   *
   * @param entity owning entity
   * @param versionRef version id or alias
   * @param loader remote lookup
   * @return cached or loaded version
   */
  public Version getOrLoad(
      final EntityPath entity, final String versionRef, final Supplier<Version> loader) {
    final var cached = get(entity, versionRef);
    if (cached.isPresent()) return cached.get();
    if (!isEnabled()) return loader.get();

    final var generation = generation(entity);
    final var seen = generation.get();
    final var loaded = loader.get();

    final var key = entity.versionKey(versionRef);
    final var entry = new CacheEntry(loaded, clock.millis() + ttl.toMillis());
    entries.put(key, entry);
    // Checked after the put: an invalidation racing with it either sees the entry or bumps first.
    if (generation.get() != seen) entries.remove(key, entry);
    return loaded;
  }

  /** Drops every cached version of {@code entity}, aliases included. */
  public void invalidate(final EntityPath entity) {
    final var prefix = entity.versionKey("");
    generation(entity).incrementAndGet();
    entries.keySet().removeIf(key -> key.startsWith(prefix));
  }

  public void clear() {
    generations.values().forEach(AtomicLong::incrementAndGet);
    entries.clear();
  }

  public CacheStatistics stats() {
    final var now = clock.millis();
    int active = 0;
    int expired = 0;
    for (final var entry : entries.values()) {
      if (entry.expiresAtMillis < now) expired++;
      else active++;
    }
    return new CacheStatistics(isEnabled(), active + expired, active, expired, ttl);
  }

  private AtomicLong generation(final EntityPath entity) {
    return generations.computeIfAbsent(entity.versionKey(""), key -> new AtomicLong());
  }

  private record CacheEntry(Version version, long expiresAtMillis) {}
}
