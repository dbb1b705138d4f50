package com.example.resilientsecrets.core.timing;

/** Sink for {@link OperationRecord}s. Receives exactly one record per public service call. */
@FunctionalInterface
public interface OperationRecorder {
  void record(OperationRecord record);
}
