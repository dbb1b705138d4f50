package com.example.resilientsecrets.core.pool;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.PoolTimeoutException;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.store.StoreClient;
import java.lang.System.Logger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Fixed-size pool of {@link StoreClient}s.
 *
 * <p>At most {@code size} handles are borrowed at once; further callers wait in {@link #acquire()}
 * up to the acquire timeout and then fail with {@link PoolTimeoutException}. Clients are opened
 * lazily and an idle client that fails {@link StoreClient#isAlive()} is discarded and replaced, so
 * callers never receive a dead client.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var pool = ConnectionPool.builder()
 *     .factory(AwsStoreClientFactory.fromEnvironment())
 *     .size(10)
 *     .acquireTimeout(Duration.ofSeconds(5))
 *     .build();
 *
 * var entity = pool.withHandle(client -> client.getEntity(path));
 * }</pre>
 *
 * <h2>Background Validation</h2>
 *
 * <pre>{@code
 * var pool = ConnectionPool.builder()
 *     .factory(factory)
 *     .validationInterval(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public final class ConnectionPool implements AutoCloseable {

  private static final Logger logger = System.getLogger(ConnectionPool.class.getName());

  private final StoreClientFactory factory;
  private final int size;
  private final Duration acquireTimeout;
  private final Semaphore permits;
  private final Deque<StoreClient> idle = new ConcurrentLinkedDeque<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final AtomicInteger borrowed = new AtomicInteger();
  private final AtomicInteger peakBorrowed = new AtomicInteger();
  private final AtomicLong borrows = new AtomicLong();
  private final AtomicLong returns = new AtomicLong();
  private final AtomicLong timeouts = new AtomicLong();
  private final AtomicLong created = new AtomicLong();
  private final AtomicLong discarded = new AtomicLong();
  private final AtomicLong waitNanos = new AtomicLong();

  private ScheduledExecutorService validator;

  private ConnectionPool(final Builder builder) {
    this.factory = builder.factory;
    this.size = builder.size;
    this.acquireTimeout = builder.acquireTimeout;
    this.permits = new Semaphore(size, true);

    final var interval = builder.validationInterval;
    if (!interval.isZero()) {
      validator =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                var t = new Thread(r, "ConnectionPool-validator");
                t.setDaemon(true);
                return t;
              });
      validator.scheduleAtFixedRate(
          this::evictDeadClients, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link ConnectionPool}. */
  public static class Builder {
    private StoreClientFactory factory;
    private int size = 10;
    private Duration acquireTimeout = Duration.ofSeconds(5);
    private Duration validationInterval = Duration.ZERO;

    private Builder() {}

    /**
     * Sets the client factory (required).
     *
     * @param factory opens new clients
     * @return this builder
     */
    public Builder factory(final StoreClientFactory factory) {
      this.factory = factory;
      return this;
    }

    /**
     * Sets the fixed pool size.
     *
     * <p>Default: 10
     *
     * @param size maximum concurrently borrowed handles, must be >= 1
     * @return this builder
     */
    public Builder size(final int size) {
      this.size = size;
      return this;
    }

    /**
     * Sets how long {@link #acquire()} waits for a free handle.
     *
     * <p>Default: 5 seconds
     *
     * @param acquireTimeout positive timeout
     * @return this builder
     */
    public Builder acquireTimeout(final Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    /**
     * Sets the interval of the background check that evicts dead idle clients.
     *
     * <p>Default: ZERO (disabled)
     *
     * @param validationInterval interval, zero to disable
     * @return this builder
     */
    public Builder validationInterval(final Duration validationInterval) {
      this.validationInterval = validationInterval;
      return this;
    }

    /**
     * Builds the pool.
     *
     * @return configured pool
     * @throws IllegalStateException if the factory is not set
     */
    public ConnectionPool build() {
      if (factory == null) throw new IllegalStateException("factory is required");
      if (size < 1) throw new IllegalArgumentException("size must be >= 1");
      if (acquireTimeout == null || acquireTimeout.isNegative() || acquireTimeout.isZero())
        throw new IllegalArgumentException("acquireTimeout must be positive");
      if (validationInterval == null || validationInterval.isNegative())
        throw new IllegalArgumentException("validationInterval must be non-negative");
      return new ConnectionPool(this);
    }
  }

  /**
   * Borrows a handle, waiting up to the acquire timeout.
   *
   * @return exclusive handle, to be released exactly once
   * @throws PoolTimeoutException if no handle became free in time
   * @throws IllegalStateException if the pool is closed
   */
  public PoolHandle acquire() {
    if (closed.get()) throw new IllegalStateException("Pool is closed");

    final var start = System.nanoTime();
    final boolean acquired;
    try {
      acquired = permits.tryAcquire(acquireTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreAccessException(
          ErrorKind.UNKNOWN, "Interrupted while waiting for a store handle", e);
    } finally {
      waitNanos.addAndGet(System.nanoTime() - start);
    }

    if (!acquired) {
      timeouts.incrementAndGet();
      logger.log(DEBUG, "Pool exhausted, {0} handles borrowed", borrowed.get());
      throw new PoolTimeoutException(acquireTimeout);
    }

    try {
      final var client = takeLiveClient();
      final var now = borrowed.incrementAndGet();
      peakBorrowed.accumulateAndGet(now, Math::max);
      borrows.incrementAndGet();
      return new PoolHandle(this, client);
    } catch (final RuntimeException e) {
      permits.release();
      throw e;
    }
  }

  /**
   * Returns a handle to the pool. Releasing an already released handle is a no-op.
   *
   * @param handle handle obtained from {@link #acquire()}
   */
  public void release(final PoolHandle handle) {
    if (handle == null || !handle.markReleased()) return;

    final var client = handle.rawClient();
    try {
      if (closed.get() || handle.isInvalid()) {
        discard(client);
      } else {
        idle.offerFirst(client);
      }
    } finally {
      borrowed.decrementAndGet();
      returns.incrementAndGet();
      permits.release();
    }
  }

  /**
   * Borrows a handle, applies {@code operation} to its client and releases the handle on every
   * exit path.
   *
   * @param operation work to run with the client
   * @param <T> result type
   * @return operation result
   */
  public <T> T withHandle(final Function<StoreClient, T> operation) {
    final var handle = acquire();
    try {
      return operation.apply(handle.client());
    } finally {
      release(handle);
    }
  }

  /**
   * Returns a snapshot of the pool counters. Never blocks.
   *
   * @return statistics snapshot
   */
  public PoolStatistics stats() {
    return new PoolStatistics(
        size,
        borrowed.get(),
        peakBorrowed.get(),
        idle.size(),
        borrows.get(),
        returns.get(),
        timeouts.get(),
        created.get(),
        discarded.get(),
        Duration.ofNanos(waitNanos.get()));
  }

  public int size() {
    return size;
  }

  public Duration acquireTimeout() {
    return acquireTimeout;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Stops background validation and closes idle clients. Borrowed clients close on release. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;

    if (validator != null) {
      validator.shutdown();
      try {
        if (!validator.awaitTermination(5, TimeUnit.SECONDS)) validator.shutdownNow();
      } catch (final InterruptedException e) {
        validator.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }

    StoreClient client;
    while ((client = idle.pollFirst()) != null) discard(client);
    logger.log(INFO, "Connection pool closed, {0} handles still borrowed", borrowed.get());
  }

  private StoreClient takeLiveClient() {
    StoreClient client;
    while ((client = idle.pollFirst()) != null) {
      if (isAlive(client)) return client;
      logger.log(WARNING, "Discarding dead store client on acquire");
      discard(client);
    }
    final var fresh = factory.create();
    created.incrementAndGet();
    return fresh;
  }

  void evictDeadClients() {
    for (final var client : new ArrayList<>(idle)) {
      if (!isAlive(client) && idle.remove(client)) {
        logger.log(WARNING, "Evicting dead idle store client");
        discard(client);
      }
    }
  }

  private boolean isAlive(final StoreClient client) {
    try {
      return client.isAlive();
    } catch (final RuntimeException e) {
      logger.log(DEBUG, "Liveness check failed", e);
      return false;
    }
  }

  private void discard(final StoreClient client) {
    discarded.incrementAndGet();
    try {
      client.close();
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to close store client", e);
    }
  }
}
