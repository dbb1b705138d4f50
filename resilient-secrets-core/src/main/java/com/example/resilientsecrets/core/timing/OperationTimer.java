package com.example.resilientsecrets.core.timing;

import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientsecrets.core.error.ExceptionMapper;
import com.example.resilientsecrets.core.error.StoreAccessException;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Wraps a public call: captures the start, runs the body, emits exactly one {@link
 * OperationRecord} and rethrows failures as {@link StoreAccessException}.
 */
public final class OperationTimer {

  private static final Logger logger = System.getLogger(OperationTimer.class.getName());

  private final OperationRecorder recorder;
  private final Clock clock;

  public OperationTimer(final OperationRecorder recorder, final Clock clock) {
    if (recorder == null) throw new IllegalArgumentException("recorder is required");
    if (clock == null) throw new IllegalArgumentException("clock is required");
    this.recorder = recorder;
    this.clock = clock;
  }

  /**
   * Times {@code body}.
   *
   * @param operation operation name
   * @param target resource path or collection the call targets
   * @param body the call
   * @param <T> result type
   * @return body result
   * @throws StoreAccessException if the body fails; raw exceptions are translated first
   */
  public <T> T time(final String operation, final Object target, final Supplier<T> body) {
    final var start = clock.instant();
    final var startNanos = System.nanoTime();
    final var entityPath = String.valueOf(target);
    try {
      final var result = body.get();
      emit(new OperationRecord(operation, entityPath, start, since(startNanos), null, null));
      return result;
    } catch (final RuntimeException e) {
      final var mapped = ExceptionMapper.translate(e, operation + " " + entityPath);
      emit(
          new OperationRecord(
              operation, entityPath, start, since(startNanos), mapped.kind(), mapped.getMessage()));
      throw mapped;
    }
  }

  /**
   * Times a call without a result.
   *
   * @param operation operation name
   * @param target resource path or collection the call targets
   * @param body the call
   */
  public void run(final String operation, final Object target, final Runnable body) {
    time(
        operation,
        target,
        () -> {
          body.run();
          return null;
        });
  }

  private void emit(final OperationRecord record) {
    try {
      recorder.record(record);
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Operation recorder failed for " + record.operation(), e);
    }
  }

  private static Duration since(final long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
