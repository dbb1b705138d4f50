package com.example.resilientsecrets.core.model;

/** The two kinds of entity held by the remote stores. */
public enum EntityKind {
  SECRET("secrets"),
  PARAMETER("parameters");

  private final String collection;

  EntityKind(final String collection) {
    this.collection = collection;
  }

  /**
   * Returns the collection segment used in resource paths, e.g. {@code secrets}.
   *
   * @return collection name
   */
  public String collection() {
    return collection;
  }
}
