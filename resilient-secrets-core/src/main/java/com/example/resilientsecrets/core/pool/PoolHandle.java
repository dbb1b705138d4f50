package com.example.resilientsecrets.core.pool;

import com.example.resilientsecrets.core.store.StoreClient;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive, borrow-scoped lease on a pooled {@link StoreClient}.
 *
 * <p>Each {@link ConnectionPool#acquire()} returns a fresh handle, so releasing a handle twice can
 * never return a client that has since been lent to another caller. Closing the handle releases
 * it.
 */
public final class PoolHandle implements AutoCloseable {

  private final ConnectionPool pool;
  private final StoreClient client;
  private final AtomicBoolean released = new AtomicBoolean(false);
  private volatile boolean invalid;

  PoolHandle(final ConnectionPool pool, final StoreClient client) {
    this.pool = pool;
    this.client = client;
  }

  /**
   * Returns the leased client.
   *
   * @return client
   * @throws IllegalStateException if the handle was already released
   */
  public StoreClient client() {
    if (released.get()) throw new IllegalStateException("Handle already released");
    return client;
  }

  /** Marks the client as broken so that release closes it instead of pooling it. */
  public void invalidate() {
    invalid = true;
  }

  public boolean isReleased() {
    return released.get();
  }

  /** Returns the handle to its pool. Subsequent calls are no-ops. */
  public void release() {
    pool.release(this);
  }

  @Override
  public void close() {
    release();
  }

  boolean markReleased() {
    return released.compareAndSet(false, true);
  }

  boolean isInvalid() {
    return invalid;
  }

  StoreClient rawClient() {
    return client;
  }
}
