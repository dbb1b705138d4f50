package com.example.resilientsecrets.core.listing;

import com.example.resilientsecrets.core.error.ErrorKind;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a batch mutation. Item failures are data, not exceptions.
 *
 * @param succeeded ids that were processed successfully
 * @param failed ids that failed, with the mapped error kind
 */
public record BatchResult(Set<String> succeeded, Map<String, ErrorKind> failed) {

  public BatchResult {
    succeeded = Set.copyOf(succeeded);
    failed = Map.copyOf(failed);
  }

  public boolean isComplete() {
    return failed.isEmpty();
  }

  public int attempted() {
    return succeeded.size() + failed.size();
  }
}
