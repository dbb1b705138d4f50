package com.example.resilientsecrets.core.store;

import java.util.List;

/**
 * One page of a listing call.
 *
 * @param items items on this page, never null
 * @param nextPageToken opaque continuation token, null when no further pages exist
 * @param <T> item type
 */
public record Page<T>(List<T> items, String nextPageToken) {

  public Page {
    items = items == null ? List.of() : List.copyOf(items);
    if (nextPageToken != null && nextPageToken.isEmpty()) nextPageToken = null;
  }

  public boolean hasNext() {
    return nextPageToken != null;
  }
}
