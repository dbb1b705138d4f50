package com.example.resilientsecrets.core.service;

import static java.lang.System.Logger.Level.INFO;

import com.example.resilientsecrets.core.StoreGateway;
import com.example.resilientsecrets.core.cache.CacheStatistics;
import com.example.resilientsecrets.core.cache.VersionCache;
import com.example.resilientsecrets.core.config.StoreAccessConfig;
import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.listing.BatchResult;
import com.example.resilientsecrets.core.listing.ListingCoordinator;
import com.example.resilientsecrets.core.listing.PagedIterable;
import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityCollection;
import com.example.resilientsecrets.core.model.EntityKind;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.model.VersionState;
import com.example.resilientsecrets.core.pool.ConnectionPool;
import com.example.resilientsecrets.core.pool.PoolStatistics;
import com.example.resilientsecrets.core.pool.StoreClientFactory;
import com.example.resilientsecrets.core.store.ListFilter;
import com.example.resilientsecrets.core.store.Page;
import com.example.resilientsecrets.core.timing.LoggingOperationRecorder;
import com.example.resilientsecrets.core.timing.OperationRecorder;
import com.example.resilientsecrets.core.timing.OperationTimer;
import com.example.resilientsecrets.core.version.VersionManager;
import java.lang.System.Logger;
import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Operations shared by {@link SecretService} and {@link ParameterService}.
 *
 * <p>Every store operation emits exactly one {@link
 * com.example.resilientsecrets.core.timing.OperationRecord} and fails only with {@link
 * StoreAccessException}. Mutations invalidate the entity's cached versions. Local accessors such
 * as {@link #poolStats()} and {@link #cacheStats()} are not timed.
 */
public abstract class EntityService implements AutoCloseable {

  private static final Logger logger = System.getLogger(EntityService.class.getName());

  final EntityCollection collection;
  final StoreGateway gateway;
  final VersionManager versions;
  final ListingCoordinator listing;
  final VersionCache cache;
  private final OperationTimer timer;
  private final ConnectionPool pool;
  private final String operationPrefix;

  EntityService(final EntityKind kind, final String operationPrefix, final Components components) {
    final var config = components.config();
    this.collection = new EntityCollection(kind, config.project(), config.location());
    this.pool = components.pool();
    this.gateway = components.versions().gateway();
    this.versions = components.versions();
    this.listing = components.listing();
    this.cache = components.cache();
    this.timer = components.timer();
    this.operationPrefix = operationPrefix;
  }

  public EntityCollection collection() {
    return collection;
  }

  /**
   * Reads entity metadata.
   *
   * @param entityId entity id
   * @return the entity
   */
  public Entity getEntity(final String entityId) {
    return timed("getEntity", target(entityId), () -> fetchEntity(path(entityId)));
  }

  /**
   * Lists every entity of the collection.
   *
   * @return restartable lazy sequence
   */
  public PagedIterable<Entity> list() {
    return list(ListFilter.ALL);
  }

  /**
   * Lists the entities matching {@code filter}.
   *
   * <p>The first page is fetched before returning and is covered by this call's operation record.
   * Later pages are fetched while iterating and fail with {@link StoreAccessException}.
   *
   * @param filter store-side filter, null for all
   * @return restartable lazy sequence
   */
  public PagedIterable<Entity> list(final ListFilter filter) {
    return timed("list", collection, () -> listing.listAll(collection, filter).prefetch());
  }

  /**
   * Fetches one page of entities.
   *
   * @param filter store-side filter, null for all
   * @param pageToken token from the previous page, null for the first
   * @param pageSize page size between 1 and 1000
   * @return one page
   */
  public Page<Entity> listPage(
      final ListFilter filter, final String pageToken, final int pageSize) {
    return timed(
        "listPage", collection, () -> listing.listPage(collection, filter, pageToken, pageSize));
  }

  /**
   * Deletes an entity with all of its versions.
   *
   * @param entityId entity id
   */
  public void delete(final String entityId) {
    timed(
        "delete",
        target(entityId),
        () -> {
          final var path = path(entityId);
          try {
            gateway.call(
                "delete " + path,
                client -> {
                  client.deleteEntity(path);
                  return path;
                });
          } finally {
            cache.invalidate(path);
          }
          logger.log(INFO, "Deleted {0}", path);
          return null;
        });
  }

  /**
   * Deletes many entities. Failures are reported per id instead of thrown.
   *
   * @param entityIds ids to delete
   * @return outcome per id
   */
  public BatchResult deleteAll(final Collection<String> entityIds) {
    return timed(
        "deleteAll",
        collection,
        () -> {
          final var result = listing.batchDelete(collection, entityIds);
          result.succeeded().forEach(id -> cache.invalidate(path(id)));
          // A failed delete may still have reached the store; malformed ids never did.
          result
              .failed()
              .forEach(
                  (id, kind) -> {
                    if (kind != ErrorKind.INVALID_ARGUMENT) cache.invalidate(path(id));
                  });
          return result;
        });
  }

  /**
   * Lists the versions of an entity in creation order, without payloads. The first page is fetched
   * before returning, as in {@link #list(ListFilter)}.
   *
   * @param entityId entity id
   * @return restartable lazy sequence
   */
  public PagedIterable<Version> listVersions(final String entityId) {
    return timed(
        "listVersions", target(entityId), () -> listing.listVersions(path(entityId)).prefetch());
  }

  /**
   * Reads version metadata in any state. Disabled versions keep their payload; destroyed ones have
   * none.
   *
   * @param entityId entity id
   * @param versionId concrete version id
   * @return the version
   */
  public Version describeVersion(final String entityId, final String versionId) {
    return timed(
        "describeVersion",
        target(entityId),
        () -> versions.describeVersion(path(entityId), versionId));
  }

  public Version enableVersion(final String entityId, final String versionId) {
    return timed(
        "enableVersion",
        target(entityId),
        () -> changeState(path(entityId), versionId, VersionState.ENABLED));
  }

  public Version disableVersion(final String entityId, final String versionId) {
    return timed(
        "disableVersion",
        target(entityId),
        () -> changeState(path(entityId), versionId, VersionState.DISABLED));
  }

  /**
   * Destroys a version. Its payload cannot be read afterwards and its id is never reused.
   *
   * @param entityId entity id
   * @param versionId concrete version id
   * @return the destroyed version
   */
  public Version destroyVersion(final String entityId, final String versionId) {
    return timed(
        "destroyVersion",
        target(entityId),
        () -> changeState(path(entityId), versionId, VersionState.DESTROYED));
  }

  /**
   * Moves a version to {@code target}.
   *
   * @param entityId entity id
   * @param versionId concrete version id
   * @param target requested state
   * @return the version in its new state
   * @throws StoreAccessException {@code INVALID_ARGUMENT} for an illegal transition
   */
  public Version setVersionState(
      final String entityId, final String versionId, final VersionState target) {
    return timed(
        "setVersionState",
        target(entityId),
        () -> changeState(path(entityId), versionId, target));
  }

  public CacheStatistics cacheStats() {
    return cache.stats();
  }

  public void clearCache() {
    cache.clear();
  }

  public PoolStatistics poolStats() {
    return pool.stats();
  }

  /** Closes the connection pool. */
  @Override
  public void close() {
    pool.close();
  }

  <T> T timed(final String operation, final Object target, final Supplier<T> body) {
    return timer.time(operationPrefix + "." + operation, target, body);
  }

  EntityPath path(final String entityId) {
    return collection.path(entityId);
  }

  String target(final String entityId) {
    return collection + "/" + entityId;
  }

  Entity fetchEntity(final EntityPath path) {
    return gateway.call("get " + path, client -> client.getEntity(path));
  }

  Entity createEntity(
      final EntityPath path, final Map<String, String> labels, final ParameterFormat format) {
    final var created =
        gateway.call("create " + path, client -> client.createEntity(path, labels, format));
    logger.log(INFO, "Created {0}", path);
    return created;
  }

  Version fetchVersion(final EntityPath path, final String versionId) {
    return cache.getOrLoad(path, versionId, () -> versions.getVersion(path, versionId));
  }

  Version appendVersion(final EntityPath path, final byte[] payload, final String customName) {
    try {
      return versions.createVersion(path, payload, customName);
    } finally {
      cache.invalidate(path);
    }
  }

  private Version changeState(
      final EntityPath path, final String versionId, final VersionState target) {
    try {
      return versions.setState(path, versionId, target);
    } finally {
      cache.invalidate(path);
    }
  }

  /** Collaborators shared by the operations of one service. */
  record Components(
      StoreAccessConfig config,
      ConnectionPool pool,
      VersionManager versions,
      ListingCoordinator listing,
      OperationTimer timer,
      VersionCache cache) {}

  /**
   * Builder for services.
   *
   * @param <S> service type
   */
  public static final class Builder<S extends EntityService> {
    private final Function<Components, S> constructor;
    private StoreAccessConfig config;
    private StoreClientFactory factory;
    private OperationRecorder recorder = new LoggingOperationRecorder();
    private Clock clock = Clock.systemUTC();
    private Executor batchExecutor = Runnable::run;

    Builder(final Function<Components, S> constructor) {
      this.constructor = constructor;
    }

    /**
     * Sets the configuration.
     *
     * <p>Default: {@link StoreAccessConfig#fromEnvironment()}
     *
     * @param config configuration
     * @return this builder
     */
    public Builder<S> config(final StoreAccessConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the factory that opens store clients (required).
     *
     * @param factory client factory
     * @return this builder
     */
    public Builder<S> factory(final StoreClientFactory factory) {
      this.factory = factory;
      return this;
    }

    /**
     * Sets the sink for operation records.
     *
     * <p>Default: {@link LoggingOperationRecorder}
     *
     * @param recorder record sink
     * @return this builder
     */
    public Builder<S> recorder(final OperationRecorder recorder) {
      this.recorder = recorder;
      return this;
    }

    public Builder<S> clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the executor running the items of batch operations.
     *
     * <p>Default: the calling thread
     *
     * @param batchExecutor executor
     * @return this builder
     */
    public Builder<S> batchExecutor(final Executor batchExecutor) {
      this.batchExecutor = batchExecutor;
      return this;
    }

    /**
     * Builds the service and its connection pool.
     *
     * @return service ready for use
     * @throws IllegalStateException if the client factory is not set
     */
    public S build() {
      if (factory == null) throw new IllegalStateException("factory is required");
      if (recorder == null) throw new IllegalArgumentException("recorder is required");
      if (clock == null) throw new IllegalArgumentException("clock is required");
      if (batchExecutor == null) throw new IllegalArgumentException("batchExecutor is required");
      final var effective = config == null ? StoreAccessConfig.fromEnvironment() : config;

      final var pool =
          ConnectionPool.builder()
              .factory(factory)
              .size(effective.poolSize())
              .acquireTimeout(effective.acquireTimeout())
              .validationInterval(effective.validationInterval())
              .build();
      final var versions =
          new VersionManager(
              new StoreGateway(pool, effective.retryPolicy()),
              effective.pageSize(),
              effective.lockTimeout());
      return constructor.apply(
          new Components(
              effective,
              pool,
              versions,
              new ListingCoordinator(versions, batchExecutor),
              new OperationTimer(recorder, clock),
              new VersionCache(effective.cacheTtl(), clock)));
    }
  }
}
