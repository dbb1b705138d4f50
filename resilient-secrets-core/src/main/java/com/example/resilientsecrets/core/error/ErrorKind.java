package com.example.resilientsecrets.core.error;

/** Closed set of failure categories surfaced to callers in place of vendor error codes. */
public enum ErrorKind {
  NOT_FOUND,
  ALREADY_EXISTS,
  PERMISSION_DENIED,
  INVALID_ARGUMENT,
  /** Vendor rate limit or quota. */
  RESOURCE_EXHAUSTED,
  /** Transient transport or service failure. */
  UNAVAILABLE,
  /** No pool handle became free within the acquire timeout. */
  POOL_TIMEOUT,
  UNKNOWN;

  /**
   * Whether failures of this kind may be retried transparently.
   *
   * @return true for {@link #UNAVAILABLE} and {@link #POOL_TIMEOUT}
   */
  public boolean isRetryable() {
    return this == UNAVAILABLE || this == POOL_TIMEOUT;
  }
}
