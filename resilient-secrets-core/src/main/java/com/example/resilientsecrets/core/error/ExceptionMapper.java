package com.example.resilientsecrets.core.error;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;

/**
 * Translates raw transport failures into {@link ErrorKind}s.
 *
 * <p>The mapping is total: every throwable maps to exactly one kind and unrecognized failures map
 * to {@link ErrorKind#UNKNOWN}. Vendor errors are classified by error-code family first and by
 * HTTP status family second, so new vendor codes fall back safely.
 *
 * <pre>{@code
 * try {
 *   client.getSecretValue(request);
 * } catch (final RuntimeException e) {
 *   throw ExceptionMapper.translate(e, "get secret 'db-pass'");
 * }
 * }</pre>
 */
public final class ExceptionMapper {

  // First match wins, so more specific markers precede broader ones.
  private static final List<CodeFamily> CODE_FAMILIES =
      List.of(
          new CodeFamily("NotFound", ErrorKind.NOT_FOUND),
          new CodeFamily("NoSuch", ErrorKind.NOT_FOUND),
          new CodeFamily("Exists", ErrorKind.ALREADY_EXISTS),
          new CodeFamily("Conflict", ErrorKind.ALREADY_EXISTS),
          new CodeFamily("AccessDenied", ErrorKind.PERMISSION_DENIED),
          new CodeFamily("Unauthorized", ErrorKind.PERMISSION_DENIED),
          new CodeFamily("Forbidden", ErrorKind.PERMISSION_DENIED),
          new CodeFamily("UnrecognizedClient", ErrorKind.PERMISSION_DENIED),
          new CodeFamily("ClientTokenId", ErrorKind.PERMISSION_DENIED),
          new CodeFamily("ExpiredToken", ErrorKind.PERMISSION_DENIED),
          new CodeFamily("Throttl", ErrorKind.RESOURCE_EXHAUSTED),
          new CodeFamily("LimitExceeded", ErrorKind.RESOURCE_EXHAUSTED),
          new CodeFamily("TooManyRequests", ErrorKind.RESOURCE_EXHAUSTED),
          new CodeFamily("QuotaExceeded", ErrorKind.RESOURCE_EXHAUSTED),
          new CodeFamily("Invalid", ErrorKind.INVALID_ARGUMENT),
          new CodeFamily("Validation", ErrorKind.INVALID_ARGUMENT),
          new CodeFamily("Malformed", ErrorKind.INVALID_ARGUMENT),
          new CodeFamily("InternalService", ErrorKind.UNAVAILABLE),
          new CodeFamily("InternalFailure", ErrorKind.UNAVAILABLE),
          new CodeFamily("Unavailable", ErrorKind.UNAVAILABLE));

  private ExceptionMapper() {}

  /**
   * Maps a raw failure to its {@link ErrorKind}.
   *
   * @param error failure to classify, may be null
   * @return the mapped kind, never null
   */
  public static ErrorKind map(final Throwable error) {
    final var root = unwrap(error);
    if (root == null) return ErrorKind.UNKNOWN;
    if (root instanceof StoreAccessException domain) return domain.kind();
    if (root instanceof AwsServiceException aws)
      return mapServiceError(errorCode(aws), aws.statusCode());
    if (root instanceof SdkServiceException sdk) return mapServiceError(null, sdk.statusCode());
    if (root instanceof SdkClientException) return ErrorKind.UNAVAILABLE;
    if (root instanceof IOException || root instanceof TimeoutException)
      return ErrorKind.UNAVAILABLE;
    if (root instanceof IllegalArgumentException) return ErrorKind.INVALID_ARGUMENT;
    return ErrorKind.UNKNOWN;
  }

  /**
   * Wraps a raw failure into a {@link StoreAccessException}, preserving the original as cause.
   * Already-mapped exceptions are returned unchanged.
   *
   * @param error failure to translate
   * @param context short description of the failed operation, e.g. {@code get secret 'db-pass'}
   * @return mapped exception
   */
  public static StoreAccessException translate(final Throwable error, final String context) {
    final var root = unwrap(error);
    if (root instanceof StoreAccessException domain) return domain;
    final var kind = map(root);
    return new StoreAccessException(
        kind, "%s failed (%s): %s".formatted(context, kind, describe(root)), error);
  }

  static ErrorKind mapServiceError(final String code, final int status) {
    if (code != null && !code.isBlank()) {
      for (final var family : CODE_FAMILIES) {
        if (code.contains(family.marker())) return family.kind();
      }
    }
    return mapStatus(status);
  }

  static ErrorKind mapStatus(final int status) {
    if (status == 401 || status == 403) return ErrorKind.PERMISSION_DENIED;
    if (status == 404) return ErrorKind.NOT_FOUND;
    if (status == 409) return ErrorKind.ALREADY_EXISTS;
    if (status == 429) return ErrorKind.RESOURCE_EXHAUSTED;
    if (status >= 500 && status <= 599) return ErrorKind.UNAVAILABLE;
    return ErrorKind.UNKNOWN;
  }

  private static String errorCode(final AwsServiceException e) {
    final var details = e.awsErrorDetails();
    if (details != null && details.errorCode() != null) return details.errorCode();
    return e.getClass().getSimpleName();
  }

  private static Throwable unwrap(final Throwable error) {
    var current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(final Throwable error) {
    if (error == null) return "no detail";
    final var message = error.getMessage();
    final var type = error.getClass().getSimpleName();
    return message == null || message.isBlank() ? type : type + ": " + message;
  }

  private record CodeFamily(String marker, ErrorKind kind) {}
}
