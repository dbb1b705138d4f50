package com.example.resilientsecrets.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * A secret or parameter as reported by the store.
 *
 * @param path resource path
 * @param labels user labels, never null
 * @param format declared value format, null for secrets
 * @param createTime creation time reported by the store
 */
public record Entity(
    EntityPath path, Map<String, String> labels, ParameterFormat format, Instant createTime) {

  public Entity {
    labels = labels == null ? Map.of() : Map.copyOf(labels);
  }
}
