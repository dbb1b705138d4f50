package com.example.resilientsecrets.core.config;

import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientsecrets.core.Retry;
import java.lang.System.Logger;
import java.time.Duration;
import java.util.Optional;

/**
 * Settings of the access layer.
 *
 * <p>Values can be set with {@link #builder()} or read by {@link #fromEnvironment()} from system
 * properties, falling back to environment variables:
 *
 * <ul>
 *   <li>store.project / STORE_PROJECT (default {@code default})
 *   <li>store.location / STORE_LOCATION (default {@code global})
 *   <li>store.pool.size / STORE_POOL_SIZE (default 10)
 *   <li>store.pool.acquire.timeout.millis / STORE_POOL_ACQUIRE_TIMEOUT_MILLIS (default 5000)
 *   <li>store.pool.validation.interval.seconds / STORE_POOL_VALIDATION_INTERVAL_SECONDS (default 0
 *       = disabled)
 *   <li>store.retry.max.attempts / STORE_RETRY_MAX_ATTEMPTS (default 3)
 *   <li>store.retry.backoff.base.millis / STORE_RETRY_BACKOFF_BASE_MILLIS (default 100)
 *   <li>store.list.page.size / STORE_LIST_PAGE_SIZE (default 100)
 *   <li>store.cache.ttl.millis / STORE_CACHE_TTL_MILLIS (default 0 = disabled)
 * </ul>
 *
 * <p>Unparseable values are logged and replaced by the default.
 */
public final class StoreAccessConfig {

  private static final Logger logger = System.getLogger(StoreAccessConfig.class.getName());

  private final String project;
  private final String location;
  private final int poolSize;
  private final Duration acquireTimeout;
  private final Duration validationInterval;
  private final int retryMaxAttempts;
  private final long retryBackoffBaseMillis;
  private final int pageSize;
  private final Duration cacheTtl;
  private final Duration lockTimeout;

  private StoreAccessConfig(final Builder builder) {
    this.project = builder.project;
    this.location = builder.location;
    this.poolSize = builder.poolSize;
    this.acquireTimeout = builder.acquireTimeout;
    this.validationInterval = builder.validationInterval;
    this.retryMaxAttempts = builder.retryMaxAttempts;
    this.retryBackoffBaseMillis = builder.retryBackoffBaseMillis;
    this.pageSize = builder.pageSize;
    this.cacheTtl = builder.cacheTtl;
    this.lockTimeout = builder.lockTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads every setting from system properties or environment variables.
   *
   * @return configuration with defaults for unset values
   */
  public static StoreAccessConfig fromEnvironment() {
    final var builder = builder();
    text("store.project", "STORE_PROJECT").ifPresent(builder::project);
    text("store.location", "STORE_LOCATION").ifPresent(builder::location);
    number("store.pool.size", "STORE_POOL_SIZE").map(Long::intValue).ifPresent(builder::poolSize);
    number("store.pool.acquire.timeout.millis", "STORE_POOL_ACQUIRE_TIMEOUT_MILLIS")
        .map(Duration::ofMillis)
        .ifPresent(builder::acquireTimeout);
    number("store.pool.validation.interval.seconds", "STORE_POOL_VALIDATION_INTERVAL_SECONDS")
        .map(Duration::ofSeconds)
        .ifPresent(builder::validationInterval);
    number("store.retry.max.attempts", "STORE_RETRY_MAX_ATTEMPTS")
        .map(Long::intValue)
        .ifPresent(builder::retryMaxAttempts);
    number("store.retry.backoff.base.millis", "STORE_RETRY_BACKOFF_BASE_MILLIS")
        .ifPresent(builder::retryBackoffBaseMillis);
    number("store.list.page.size", "STORE_LIST_PAGE_SIZE")
        .map(Long::intValue)
        .ifPresent(builder::pageSize);
    number("store.cache.ttl.millis", "STORE_CACHE_TTL_MILLIS")
        .map(Duration::ofMillis)
        .ifPresent(builder::cacheTtl);
    return builder.build();
  }

  public String project() {
    return project;
  }

  public String location() {
    return location;
  }

  public int poolSize() {
    return poolSize;
  }

  public Duration acquireTimeout() {
    return acquireTimeout;
  }

  public Duration validationInterval() {
    return validationInterval;
  }

  public int retryMaxAttempts() {
    return retryMaxAttempts;
  }

  public long retryBackoffBaseMillis() {
    return retryBackoffBaseMillis;
  }

  public int pageSize() {
    return pageSize;
  }

  public Duration cacheTtl() {
    return cacheTtl;
  }

  public Duration lockTimeout() {
    return lockTimeout;
  }

  /**
   * Exponential backoff policy for transient failures.
   *
   * @return retry policy built from the retry settings
   */
  public Retry.Policy retryPolicy() {
    return retryMaxAttempts == 1
        ? Retry.Policy.none()
        : Retry.Policy.exponential(retryMaxAttempts, retryBackoffBaseMillis);
  }

  @Override
  public String toString() {
    return ("StoreAccessConfig[project=%s, location=%s, poolSize=%d, acquireTimeout=%s,"
            + " pageSize=%d, cacheTtl=%s]")
        .formatted(project, location, poolSize, acquireTimeout, pageSize, cacheTtl);
  }

  private static Optional<String> text(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim);
  }

  private static Optional<Long> number(final String property, final String env) {
    return text(property, env)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                logger.log(WARNING, "Ignoring non-numeric value {0} for {1}", val, property);
                return Optional.empty();
              }
            });
  }

  /** Builder for {@link StoreAccessConfig}. */
  public static class Builder {
    private String project = "default";
    private String location = "global";
    private int poolSize = 10;
    private Duration acquireTimeout = Duration.ofSeconds(5);
    private Duration validationInterval = Duration.ZERO;
    private int retryMaxAttempts = 3;
    private long retryBackoffBaseMillis = 100;
    private int pageSize = 100;
    private Duration cacheTtl = Duration.ZERO;
    private Duration lockTimeout = Duration.ofSeconds(10);

    private Builder() {}

    public Builder project(final String project) {
      this.project = project;
      return this;
    }

    public Builder location(final String location) {
      this.location = location;
      return this;
    }

    /**
     * Sets the number of pooled store clients.
     *
     * <p>Default: 10
     *
     * @param poolSize size, must be >= 1
     * @return this builder
     */
    public Builder poolSize(final int poolSize) {
      this.poolSize = poolSize;
      return this;
    }

    public Builder acquireTimeout(final Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    public Builder validationInterval(final Duration validationInterval) {
      this.validationInterval = validationInterval;
      return this;
    }

    /**
     * Sets the attempts per remote call, first attempt included.
     *
     * <p>Default: 3
     *
     * @param retryMaxAttempts attempts, must be >= 1
     * @return this builder
     */
    public Builder retryMaxAttempts(final int retryMaxAttempts) {
      this.retryMaxAttempts = retryMaxAttempts;
      return this;
    }

    public Builder retryBackoffBaseMillis(final long retryBackoffBaseMillis) {
      this.retryBackoffBaseMillis = retryBackoffBaseMillis;
      return this;
    }

    /**
     * Sets the page size used when listings are driven to completion.
     *
     * <p>Default: 100
     *
     * @param pageSize page size between 1 and 1000
     * @return this builder
     */
    public Builder pageSize(final int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /**
     * Sets the read cache TTL.
     *
     * <p>Default: ZERO (disabled)
     *
     * @param cacheTtl ttl, zero to disable
     * @return this builder
     */
    public Builder cacheTtl(final Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    /**
     * Sets how long a mutation waits for a concurrent mutation of the same version or entity.
     *
     * <p>Default: 10 seconds
     *
     * @param lockTimeout positive timeout
     * @return this builder
     */
    public Builder lockTimeout(final Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public StoreAccessConfig build() {
      requireText("project", project);
      requireText("location", location);
      if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
      requirePositive("acquireTimeout", acquireTimeout);
      if (validationInterval == null || validationInterval.isNegative())
        throw new IllegalArgumentException("validationInterval must be >= 0");
      if (retryMaxAttempts < 1) throw new IllegalArgumentException("retryMaxAttempts must be >= 1");
      if (retryBackoffBaseMillis < 0)
        throw new IllegalArgumentException("retryBackoffBaseMillis must be >= 0");
      if (pageSize < 1 || pageSize > 1000)
        throw new IllegalArgumentException("pageSize must be between 1 and 1000");
      if (cacheTtl == null || cacheTtl.isNegative())
        throw new IllegalArgumentException("cacheTtl must be >= 0");
      requirePositive("lockTimeout", lockTimeout);
      return new StoreAccessConfig(this);
    }

    private static void requireText(final String name, final String value) {
      if (value == null || value.isBlank())
        throw new IllegalArgumentException(name + " must not be blank");
    }

    private static void requirePositive(final String name, final Duration value) {
      if (value == null || value.isNegative() || value.isZero())
        throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
