package com.example.resilientsecrets.core.listing;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.ExceptionMapper;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityCollection;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.store.ListFilter;
import com.example.resilientsecrets.core.store.Page;
import com.example.resilientsecrets.core.version.VersionManager;
import java.lang.System.Logger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Drives paginated listings to completion and runs batch operations that tolerate partial failure.
 *
 * <p>Listings are lazy {@link PagedIterable}s: a pool handle is borrowed for each page fetch, never
 * across pulls. Batch operations attempt every id and report failures in their result instead of
 * throwing. Batch items run on the configured {@link Executor}; the default runs them on the
 * calling thread.
 */
public final class ListingCoordinator {

  private static final Logger logger = System.getLogger(ListingCoordinator.class.getName());

  private final VersionManager versions;
  private final Executor executor;

  public ListingCoordinator(final VersionManager versions) {
    this(versions, Runnable::run);
  }

  /**
   * @param versions version manager whose gateway and page size are used
   * @param executor runs batch items; items may run concurrently
   */
  public ListingCoordinator(final VersionManager versions, final Executor executor) {
    if (versions == null) throw new IllegalArgumentException("versions is required");
    if (executor == null) throw new IllegalArgumentException("executor is required");
    this.versions = versions;
    this.executor = executor;
  }

  /**
   * Lists every entity of a collection matching {@code filter}.
   *
   * @param collection collection to list
   * @param filter store-side filter
   * @return restartable lazy sequence of entities
   */
  public PagedIterable<Entity> listAll(final EntityCollection collection, final ListFilter filter) {
    final var effective = filter == null ? ListFilter.ALL : filter;
    return new PagedIterable<>(
        token -> listPage(collection, effective, token, versions.pageSize()));
  }

  /**
   * Fetches a single page of entities.
   *
   * @param collection collection to list
   * @param filter store-side filter
   * @param pageToken continuation token from a previous page, null for the first page
   * @param pageSize page size between 1 and 1000
   * @return one page
   */
  public Page<Entity> listPage(
      final EntityCollection collection,
      final ListFilter filter,
      final String pageToken,
      final int pageSize) {
    if (pageSize < 1 || pageSize > 1000)
      throw StoreAccessException.invalidArgument("Page size must be between 1 and 1000");
    final var effective = filter == null ? ListFilter.ALL : filter;
    return versions
        .gateway()
        .call(
            "list " + collection,
            client -> client.listEntities(collection, effective, pageToken, pageSize));
  }

  /**
   * Lists every version of an entity in creation order.
   *
   * @param entity owning entity
   * @return restartable lazy sequence of versions
   */
  public PagedIterable<Version> listVersions(final EntityPath entity) {
    return new PagedIterable<>(token -> versions.versionPage(entity, token, versions.pageSize()));
  }

  /**
   * Deletes many entities. One failing id does not stop the others.
   *
   * @param collection collection the ids belong to
   * @param entityIds ids to delete; duplicates are attempted once
   * @return ids deleted and ids that failed with their error kind
   */
  public BatchResult batchDelete(
      final EntityCollection collection, final Collection<String> entityIds) {
    final var ids = distinct(entityIds);
    final Set<String> succeeded = ConcurrentHashMap.newKeySet();
    final Map<String, ErrorKind> failed = new ConcurrentHashMap<>();

    runAll(
        ids,
        id -> {
          try {
            final var path = collection.path(id);
            versions
                .gateway()
                .call(
                    "delete " + path,
                    client -> {
                      client.deleteEntity(path);
                      return path;
                    });
            succeeded.add(id);
          } catch (final RuntimeException e) {
            failed.put(id, ExceptionMapper.map(e));
            logger.log(DEBUG, "Batch delete of {0} failed: {1}", id, e.getMessage());
          }
        });

    logger.log(
        INFO,
        "Batch delete in {0}: {1} succeeded, {2} failed",
        collection,
        succeeded.size(),
        failed.size());
    return new BatchResult(succeeded, failed);
  }

  /**
   * Fetches many entities' values. One failing id does not stop the others.
   *
   * @param collection collection the ids belong to
   * @param entityIds ids to fetch; duplicates are fetched once
   * @param fetch per-entity fetch, e.g. the latest enabled version
   * @param <T> value type
   * @return fetched values and ids that failed with their error kind
   */
  public <T> BatchFetchResult<T> batchGet(
      final EntityCollection collection,
      final Collection<String> entityIds,
      final Function<EntityPath, T> fetch) {
    final var ids = distinct(entityIds);
    final Map<String, T> values = new ConcurrentHashMap<>();
    final Map<String, ErrorKind> failed = new ConcurrentHashMap<>();

    runAll(
        ids,
        id -> {
          try {
            final var value = fetch.apply(collection.path(id));
            if (value == null) failed.put(id, ErrorKind.NOT_FOUND);
            else values.put(id, value);
          } catch (final RuntimeException e) {
            failed.put(id, ExceptionMapper.map(e));
          }
        });

    logger.log(
        DEBUG,
        "Batch get in {0}: {1} fetched, {2} failed",
        collection,
        values.size(),
        failed.size());
    return new BatchFetchResult<>(values, failed);
  }

  private void runAll(final Set<String> ids, final Consumer<String> task) {
    final var futures = new ArrayList<CompletableFuture<Void>>(ids.size());
    for (final var id : ids)
      futures.add(CompletableFuture.runAsync(() -> task.accept(id), executor));
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
  }

  private static Set<String> distinct(final Collection<String> entityIds) {
    if (entityIds == null) throw StoreAccessException.invalidArgument("entityIds is required");
    final var ids = new LinkedHashSet<String>();
    for (final var id : entityIds) {
      if (id == null) throw StoreAccessException.invalidArgument("entityIds must not contain null");
      ids.add(id);
    }
    return ids;
  }
}
