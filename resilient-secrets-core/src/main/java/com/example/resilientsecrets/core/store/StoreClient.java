package com.example.resilientsecrets.core.store;

import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityCollection;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.model.VersionState;
import java.util.Map;

/**
 * Session with a remote secret or parameter store.
 *
 * <p>Implementations report failures with the vendor's own exceptions; callers translate them with
 * {@link com.example.resilientsecrets.core.error.ExceptionMapper}. A client is used by one
 * operation at a time and is pooled by {@link
 * com.example.resilientsecrets.core.pool.ConnectionPool}.
 */
public interface StoreClient extends AutoCloseable {

  /**
   * Creates an entity without versions.
   *
   * @param path resource path
   * @param labels user labels
   * @param format declared format for parameters, null for secrets
   * @return the created entity
   */
  Entity createEntity(EntityPath path, Map<String, String> labels, ParameterFormat format);

  Entity getEntity(EntityPath path);

  /**
   * Lists entities of a collection in a stable order.
   *
   * @param collection collection to list
   * @param filter store-side filter
   * @param pageToken continuation token from the previous page, null for the first page
   * @param pageSize maximum number of items to return
   * @return one page of entities
   */
  Page<Entity> listEntities(
      EntityCollection collection, ListFilter filter, String pageToken, int pageSize);

  /** Deletes the entity and all of its versions. */
  void deleteEntity(EntityPath path);

  /**
   * Adds a version. The new version starts {@link VersionState#ENABLED}.
   *
   * @param path owning entity
   * @param payload payload bytes
   * @param customName caller-chosen version id, or null for a store-assigned sequence number
   * @return the created version
   */
  Version addVersion(EntityPath path, byte[] payload, String customName);

  /**
   * Returns version metadata and payload regardless of state. Destroyed versions carry no payload.
   */
  Version getVersion(EntityPath path, String versionId);

  /** Moves a version between {@link VersionState#ENABLED} and {@link VersionState#DISABLED}. */
  Version updateVersionState(EntityPath path, String versionId, VersionState state);

  /** Irreversibly destroys a version's payload. */
  Version destroyVersion(EntityPath path, String versionId);

  /**
   * Lists versions of an entity in creation order. Listed versions carry no payload.
   *
   * @param path owning entity
   * @param pageToken continuation token, null for the first page
   * @param pageSize maximum number of items to return
   * @return one page of versions
   */
  Page<Version> listVersions(EntityPath path, String pageToken, int pageSize);

  /**
   * Cheap liveness check run by the pool before handing out an idle client.
   *
   * @return false if the client must be discarded
   */
  boolean isAlive();

  @Override
  void close();
}
