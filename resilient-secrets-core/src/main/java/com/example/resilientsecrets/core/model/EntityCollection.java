package com.example.resilientsecrets.core.model;

/**
 * All entities of one kind in one project and location, rendered as {@code
 * projects/{project}/locations/{location}/{secrets|parameters}}.
 *
 * @param kind entity kind
 * @param project owning project
 * @param location store location
 */
public record EntityCollection(EntityKind kind, String project, String location) {

  public EntityCollection {
    EntityPath.validateCollection(kind, project, location);
  }

  /**
   * Returns the path of an entity in this collection.
   *
   * @param entityId entity id
   * @return entity path
   * @throws IllegalArgumentException if the id is malformed
   */
  public EntityPath path(final String entityId) {
    return new EntityPath(kind, project, location, entityId);
  }

  @Override
  public String toString() {
    return "projects/%s/locations/%s/%s".formatted(project, location, kind.collection());
  }
}
