package com.example.resilientsecrets.core.error;

/**
 * Domain failure raised by the access layer. Carries an {@link ErrorKind} and a human-readable
 * cause; the original transport exception, if any, is kept as the cause.
 */
public class StoreAccessException extends RuntimeException {

  private final ErrorKind kind;

  public StoreAccessException(final ErrorKind kind, final String message) {
    this(kind, message, null);
  }

  public StoreAccessException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    if (kind == null) throw new IllegalArgumentException("kind is required");
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }

  public static StoreAccessException notFound(final String message) {
    return new StoreAccessException(ErrorKind.NOT_FOUND, message);
  }

  public static StoreAccessException alreadyExists(final String message) {
    return new StoreAccessException(ErrorKind.ALREADY_EXISTS, message);
  }

  public static StoreAccessException invalidArgument(final String message) {
    return new StoreAccessException(ErrorKind.INVALID_ARGUMENT, message);
  }
}
