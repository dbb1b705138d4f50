package com.example.resilientsecrets.core.listing;

import com.example.resilientsecrets.core.error.ErrorKind;
import java.util.Map;

/**
 * Outcome of a batch read.
 *
 * @param values fetched values by id
 * @param failed ids that could not be fetched, with the mapped error kind
 * @param <T> value type
 */
public record BatchFetchResult<T>(Map<String, T> values, Map<String, ErrorKind> failed) {

  public BatchFetchResult {
    values = Map.copyOf(values);
    failed = Map.copyOf(failed);
  }

  public boolean isComplete() {
    return failed.isEmpty();
  }
}
