package com.example.resilientsecrets.core.cache;

import java.time.Duration;

/**
 * Snapshot of a {@link VersionCache}.
 *
 * @param enabled whether caching is on
 * @param size entries held, expired ones included
 * @param activeEntries entries still within their TTL
 * @param expiredEntries entries past their TTL that have not been evicted yet
 * @param ttl time to live of new entries
 */
public record CacheStatistics(
    boolean enabled, int size, int activeEntries, int expiredEntries, Duration ttl) {}
