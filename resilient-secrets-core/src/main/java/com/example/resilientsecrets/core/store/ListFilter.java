package com.example.resilientsecrets.core.store;

import java.util.Map;

/**
 * Store-side filter for entity listings.
 *
 * @param idPrefix entity id prefix, null or empty to match all ids
 * @param labels labels an entity must carry with equal values, never null
 */
public record ListFilter(String idPrefix, Map<String, String> labels) {

  public static final ListFilter ALL = new ListFilter(null, Map.of());

  public ListFilter {
    labels = labels == null ? Map.of() : Map.copyOf(labels);
    if (idPrefix != null && idPrefix.isEmpty()) idPrefix = null;
  }

  public static ListFilter idPrefix(final String prefix) {
    return new ListFilter(prefix, Map.of());
  }

  public static ListFilter label(final String key, final String value) {
    return new ListFilter(null, Map.of(key, value));
  }

  /**
   * Evaluates the filter locally. Stores without native filtering use this.
   *
   * @param entityId candidate entity id
   * @param entityLabels candidate labels
   * @return true if the entity matches
   */
  public boolean matches(final String entityId, final Map<String, String> entityLabels) {
    if (idPrefix != null && !entityId.startsWith(idPrefix)) return false;
    for (final var required : labels.entrySet()) {
      if (!required.getValue().equals(entityLabels.get(required.getKey()))) return false;
    }
    return true;
  }
}
