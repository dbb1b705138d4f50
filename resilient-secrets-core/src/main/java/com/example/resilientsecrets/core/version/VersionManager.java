package com.example.resilientsecrets.core.version;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.resilientsecrets.core.StoreGateway;
import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.model.VersionState;
import com.example.resilientsecrets.core.store.Page;
import java.lang.System.Logger;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Version lifecycle for one entity kind.
 *
 * <p>State machine per version: {@code ENABLED <-> DISABLED -> DESTROYED}, where {@code DESTROYED}
 * is terminal. Illegal transitions and name conflicts are rejected before any mutating remote call.
 * State changes of the same version are serialized; creations are serialized per entity. Reads are
 * not locked.
 *
 * <pre>{@code
 * var versions = new VersionManager(gateway, 100, Duration.ofSeconds(5));
 * versions.createVersion(path, payload, "v-initial");
 * var latest = versions.getVersion(path, VersionNames.LATEST);
 * versions.setState(path, "v-initial", VersionState.DISABLED);
 * }</pre>
 */
public final class VersionManager {

  private static final Logger logger = System.getLogger(VersionManager.class.getName());

  private final StoreGateway gateway;
  private final int pageSize;
  private final KeyedLocks locks;

  /**
   * @param gateway gateway used for every remote call
   * @param pageSize page size used when scanning versions
   * @param lockTimeout how long a mutation waits for a concurrent mutation of the same key
   */
  public VersionManager(
      final StoreGateway gateway, final int pageSize, final Duration lockTimeout) {
    if (gateway == null) throw new IllegalArgumentException("gateway is required");
    if (pageSize < 1 || pageSize > 1000)
      throw new IllegalArgumentException("pageSize must be between 1 and 1000");
    if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero())
      throw new IllegalArgumentException("lockTimeout must be positive");
    this.gateway = gateway;
    this.pageSize = pageSize;
    this.locks = new KeyedLocks(lockTimeout);
  }

  public StoreGateway gateway() {
    return gateway;
  }

  public int pageSize() {
    return pageSize;
  }

  /**
   * Adds a version to {@code entity}.
   *
   * @param entity owning entity
   * @param payload payload bytes
   * @param customName caller-chosen id, or null for a store-assigned sequence number
   * @return the new version, in state {@code ENABLED}
   * @throws StoreAccessException {@code ALREADY_EXISTS} if any version of the entity, including a
   *     destroyed one, already uses {@code customName}; {@code INVALID_ARGUMENT} for malformed
   *     names
   */
  public Version createVersion(
      final EntityPath entity, final byte[] payload, final String customName) {
    if (payload == null) throw StoreAccessException.invalidArgument("payload is required");
    if (customName != null) VersionNames.requireCustomName(customName);

    return locks.withLock(
        entity.toString(),
        () -> {
          if (customName != null) requireUnusedName(entity, customName);
          final var created =
              gateway.call(
                  "add version to " + entity,
                  client -> client.addVersion(entity, payload, customName));
          logger.log(INFO, "Created version {0} of {1}", created.versionId(), entity);
          return created;
        });
  }

  /**
   * Returns an accessible version.
   *
   * <p>{@code latest} resolves to the newest {@code ENABLED} version by creation time; custom-named
   * versions take part by creation time, not by name.
   *
   * @param entity owning entity
   * @param versionId version id or {@link VersionNames#LATEST}
   * @return the enabled version with its payload
   * @throws StoreAccessException {@code NOT_FOUND} if the entity or version is absent, if no
   *     version is enabled, or if the named version is disabled or destroyed
   */
  public Version getVersion(final EntityPath entity, final String versionId) {
    VersionNames.requireVersionRef(versionId, true);
    if (VersionNames.LATEST.equals(versionId)) return resolveLatest(entity);

    final var version = describeVersion(entity, versionId);
    if (version.state() != VersionState.ENABLED)
      throw StoreAccessException.notFound(
          "Version '%s' of %s is %s".formatted(versionId, entity, version.state()));
    return version;
  }

  /**
   * Returns version metadata in any state. Destroyed versions carry no payload.
   *
   * @param entity owning entity
   * @param versionId concrete version id
   * @return the version
   */
  public Version describeVersion(final EntityPath entity, final String versionId) {
    VersionNames.requireVersionRef(versionId, false);
    return gateway.call(
        "get version '%s' of %s".formatted(versionId, entity),
        client -> client.getVersion(entity, versionId));
  }

  /**
   * Moves a version to {@code target}.
   *
   * @param entity owning entity
   * @param versionId concrete version id
   * @param target requested state
   * @return the version in its new state
   * @throws StoreAccessException {@code INVALID_ARGUMENT} for illegal transitions, leaving the
   *     state unchanged
   */
  public Version setState(
      final EntityPath entity, final String versionId, final VersionState target) {
    if (target == null) throw StoreAccessException.invalidArgument("target state is required");
    VersionNames.requireVersionRef(versionId, false);

    return locks.withLock(
        entity.versionKey(versionId),
        () -> {
          final var current = describeVersion(entity, versionId);
          if (!current.state().canTransitionTo(target))
            throw StoreAccessException.invalidArgument(
                "Illegal transition %s -> %s for version '%s' of %s"
                    .formatted(current.state(), target, versionId, entity));

          final var updated =
              target == VersionState.DESTROYED
                  ? destroyOnce(entity, versionId)
                  : gateway.call(
                      "set version '%s' of %s to %s".formatted(versionId, entity, target),
                      client -> client.updateVersionState(entity, versionId, target));
          logger.log(
              INFO, "Version {0} of {1}: {2} -> {3}", versionId, entity, current.state(), target);
          return updated;
        });
  }

  /**
   * Destroys a version. The payload is unrecoverable afterwards.
   *
   * @param entity owning entity
   * @param versionId concrete version id
   * @return the destroyed version, without payload
   */
  public Version destroy(final EntityPath entity, final String versionId) {
    return setState(entity, versionId, VersionState.DESTROYED);
  }

  /**
   * Fetches one page of versions.
   *
   * @param entity owning entity
   * @param pageToken continuation token, null for the first page
   * @param size page size
   * @return page of versions in creation order
   */
  public Page<Version> versionPage(
      final EntityPath entity, final String pageToken, final int size) {
    return gateway.call(
        "list versions of " + entity, client -> client.listVersions(entity, pageToken, size));
  }

  /**
   * Destroys a version that was not destroyed when the lock was taken. If a retried call is
   * rejected because the version is already destroyed, an earlier attempt reached the store and
   * only its response was lost, so the destroyed version is returned.
   */
  private Version destroyOnce(final EntityPath entity, final String versionId) {
    try {
      return gateway.call(
          "destroy version '%s' of %s".formatted(versionId, entity),
          client -> client.destroyVersion(entity, versionId));
    } catch (final StoreAccessException e) {
      if (e.kind() != ErrorKind.INVALID_ARGUMENT) throw e;
      final var stored = describeVersion(entity, versionId);
      if (stored.state() != VersionState.DESTROYED) throw e;
      logger.log(
          INFO, "Version {0} of {1} was destroyed by an earlier attempt", versionId, entity);
      return stored;
    }
  }

  private Version resolveLatest(final EntityPath entity) {
    final var latest = new Version[1];
    forEachVersion(
        entity,
        version -> {
          if (version.state() != VersionState.ENABLED) return;
          // Later store order wins ties on creation time.
          if (latest[0] == null || !version.createTime().isBefore(latest[0].createTime()))
            latest[0] = version;
        });
    if (latest[0] == null)
      throw StoreAccessException.notFound("%s has no enabled versions".formatted(entity));
    final var versionId = latest[0].versionId();
    logger.log(DEBUG, "Resolved latest version of {0} to {1}", entity, versionId);

    // Listings carry no payload; read the chosen version itself.
    final var version = describeVersion(entity, versionId);
    if (version.state() != VersionState.ENABLED)
      throw StoreAccessException.notFound(
          "Latest version '%s' of %s changed to %s while resolving"
              .formatted(versionId, entity, version.state()));
    return version;
  }

  private void requireUnusedName(final EntityPath entity, final String customName) {
    final var existing = new Version[1];
    forEachVersion(
        entity,
        version -> {
          if (existing[0] == null && customName.equals(version.versionId())) existing[0] = version;
        });
    if (existing[0] == null) return;

    final var detail =
        existing[0].state() == VersionState.DESTROYED
            ? "was used by a destroyed version and cannot be reused"
            : "is already in use";
    throw StoreAccessException.alreadyExists(
        "Version name '%s' of %s %s".formatted(customName, entity, detail));
  }

  private void forEachVersion(final EntityPath entity, final Consumer<Version> consumer) {
    String token = null;
    do {
      final var page = versionPage(entity, token, pageSize);
      page.items().forEach(consumer);
      token = page.nextPageToken();
    } while (token != null);
  }
}
