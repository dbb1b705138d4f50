package com.example.resilientsecrets.core.error;

import java.time.Duration;

/** Raised when no pool handle becomes free within the configured acquire timeout. */
public final class PoolTimeoutException extends StoreAccessException {

  public PoolTimeoutException(final Duration timeout) {
    super(
        ErrorKind.POOL_TIMEOUT,
        "Timed out after %d ms waiting for a store handle".formatted(timeout.toMillis()));
  }
}
