package com.example.resilientsecrets.core;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.ExceptionMapper;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.pool.ConnectionPool;
import com.example.resilientsecrets.core.pool.PoolHandle;
import com.example.resilientsecrets.core.store.StoreClient;

/**
 * Runs single remote calls: borrows a pool handle, invokes the store, translates failures with
 * {@link ExceptionMapper} and retries transient ones.
 *
 * <p>The handle is released on every exit path. A client that failed with {@code UNAVAILABLE} is
 * invalidated so the pool opens a fresh one.
 *
 * @param pool connection pool to borrow from
 * @param retryPolicy retry policy for transient failures
 */
public record StoreGateway(ConnectionPool pool, Retry.Policy retryPolicy) {

  public StoreGateway {
    if (pool == null) throw new IllegalArgumentException("pool is required");
    if (retryPolicy == null) throw new IllegalArgumentException("retryPolicy is required");
  }

  /**
   * Invokes {@code call} against a pooled client.
   *
   * @param description operation description, e.g. {@code get version 'latest' of ...}
   * @param call remote call
   * @param <T> result type
   * @return call result
   * @throws StoreAccessException on any failure, never a raw vendor exception
   */
  public <T> T call(final String description, final StoreCall<T> call) {
    return Retry.onRetryable(() -> callOnce(description, call), retryPolicy, description);
  }

  private <T> T callOnce(final String description, final StoreCall<T> call) {
    final PoolHandle handle;
    try {
      handle = pool.acquire();
    } catch (final RuntimeException e) {
      throw ExceptionMapper.translate(e, description);
    }

    try {
      return call.apply(handle.client());
    } catch (final RuntimeException e) {
      final var mapped = ExceptionMapper.translate(e, description);
      if (mapped.kind() == ErrorKind.UNAVAILABLE) handle.invalidate();
      throw mapped;
    } finally {
      pool.release(handle);
    }
  }

  /**
   * A remote call against one client.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface StoreCall<T> {
    T apply(StoreClient client);
  }
}
