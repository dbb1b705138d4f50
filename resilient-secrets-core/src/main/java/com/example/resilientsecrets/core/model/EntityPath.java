package com.example.resilientsecrets.core.model;

import java.util.regex.Pattern;

/**
 * Resource path of a secret or parameter.
 *
 * <p>Rendered as {@code projects/{project}/locations/{location}/{collection}/{entityId}}. The path
 * is immutable and identifies the entity for its whole lifetime.
 *
 * @param kind entity kind
 * @param project owning project
 * @param location store location, e.g. {@code global}
 * @param entityId entity identifier, {@code [A-Za-z0-9_-]{1,255}}
 */
public record EntityPath(EntityKind kind, String project, String location, String entityId) {

  private static final Pattern ENTITY_ID = Pattern.compile("[A-Za-z0-9_-]{1,255}");
  private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]{1,128}");
  private static final Pattern RENDERED =
      Pattern.compile("projects/([^/]+)/locations/([^/]+)/(secrets|parameters)/([^/]+)");

  public EntityPath {
    validateCollection(kind, project, location);
    requireMatch("entityId", entityId, ENTITY_ID);
  }

  /**
   * Parses a rendered resource path.
   *
   * @param path path such as {@code projects/p/locations/global/secrets/db-pass}
   * @return parsed path
   * @throws IllegalArgumentException if the path is malformed
   */
  public static EntityPath parse(final String path) {
    final var matcher = RENDERED.matcher(path == null ? "" : path);
    if (!matcher.matches()) throw new IllegalArgumentException("Malformed resource path: " + path);
    final var kind = "secrets".equals(matcher.group(3)) ? EntityKind.SECRET : EntityKind.PARAMETER;
    return new EntityPath(kind, matcher.group(1), matcher.group(2), matcher.group(4));
  }

  /**
   * Returns the collection this entity belongs to.
   *
   * @return parent collection
   */
  public EntityCollection collection() {
    return new EntityCollection(kind, project, location);
  }

  /**
   * Returns a key identifying one version of this entity, used for per-version locking and
   * caching.
   *
   * @param versionId version id or alias
   * @return version key
   */
  public String versionKey(final String versionId) {
    return this + "/versions/" + versionId;
  }

  @Override
  public String toString() {
    return "projects/%s/locations/%s/%s/%s"
        .formatted(project, location, kind.collection(), entityId);
  }

  static void validateCollection(
      final EntityKind kind, final String project, final String location) {
    if (kind == null) throw new IllegalArgumentException("kind is required");
    requireMatch("project", project, SEGMENT);
    requireMatch("location", location, SEGMENT);
  }

  private static void requireMatch(final String name, final String value, final Pattern pattern) {
    if (value == null || !pattern.matcher(value).matches())
      throw new IllegalArgumentException("Invalid " + name + ": " + value);
  }
}
