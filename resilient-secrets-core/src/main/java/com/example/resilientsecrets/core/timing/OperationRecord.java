package com.example.resilientsecrets.core.timing;

import com.example.resilientsecrets.core.error.ErrorKind;
import java.time.Duration;
import java.time.Instant;

/**
 * Timing and outcome of one public service call.
 *
 * @param operation operation name, e.g. {@code secret.get}
 * @param entityPath target resource path or collection
 * @param start wall-clock start, captured before any pool acquisition
 * @param duration elapsed time until return or throw
 * @param errorKind mapped failure kind, null on success
 * @param errorMessage failure message, null on success
 */
public record OperationRecord(
    String operation,
    String entityPath,
    Instant start,
    Duration duration,
    ErrorKind errorKind,
    String errorMessage) {

  public static final String SUCCESS = "SUCCESS";

  public boolean succeeded() {
    return errorKind == null;
  }

  /**
   * Returns {@link #SUCCESS} or the name of the error kind.
   *
   * @return outcome label
   */
  public String outcome() {
    return errorKind == null ? SUCCESS : errorKind.name();
  }
}
