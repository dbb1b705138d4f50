package com.example.resilientsecrets.core.timing;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Writes each record as one {@code key=value} line through {@link System.Logger}. Successful calls
 * log at INFO; caller errors at WARNING; store and infrastructure errors at ERROR.
 */
public final class LoggingOperationRecorder implements OperationRecorder {

  private static final Logger logger = System.getLogger(LoggingOperationRecorder.class.getName());

  @Override
  public void record(final OperationRecord record) {
    final var message =
        "operation={0} entity={1} outcome={2} durationMs={3} start={4}"
            + (record.succeeded() ? "" : " error=\"{5}\"");
    logger.log(
        levelFor(record),
        message,
        record.operation(),
        record.entityPath(),
        record.outcome(),
        record.duration().toMillis(),
        record.start(),
        record.errorMessage());
  }

  static Level levelFor(final OperationRecord record) {
    if (record.succeeded()) return INFO;
    return switch (record.errorKind()) {
      case NOT_FOUND, ALREADY_EXISTS, INVALID_ARGUMENT -> WARNING;
      case PERMISSION_DENIED, RESOURCE_EXHAUSTED, UNAVAILABLE, POOL_TIMEOUT, UNKNOWN -> ERROR;
    };
  }
}
