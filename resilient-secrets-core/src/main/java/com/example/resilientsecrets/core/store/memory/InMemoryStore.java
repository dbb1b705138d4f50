package com.example.resilientsecrets.core.store.memory;

import static com.example.resilientsecrets.core.store.SecretsManagerErrors.exists;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.invalidParameter;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.invalidRequest;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.invalidToken;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.notFound;
import static java.lang.System.Logger.Level.DEBUG;

import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityCollection;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.model.VersionState;
import com.example.resilientsecrets.core.pool.StoreClientFactory;
import com.example.resilientsecrets.core.store.ListFilter;
import com.example.resilientsecrets.core.store.Page;
import com.example.resilientsecrets.core.version.VersionNames;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * In-process store shared by any number of {@link InMemoryStoreClient}s.
 *
 * <p>Failures are reported as Secrets Manager service exceptions carrying the real error codes, so
 * the access layer sees the same envelopes it sees in production. Listings use keyset pagination
 * over entity ids: an entity that exists for the whole iteration is returned exactly once.
 * Version ids are never reused, even after their version is destroyed.
 *
 * <pre>{@code
 * var store = new InMemoryStore();
 * var pool = ConnectionPool.builder().factory(store.clientFactory()).build();
 * }</pre>
 */
public final class InMemoryStore {

  private static final Logger logger = System.getLogger(InMemoryStore.class.getName());

  private final Clock clock;
  private final TreeMap<String, StoredEntity> entities = new TreeMap<>();
  private final Map<String, AtomicLong> callCounts = new ConcurrentHashMap<>();
  private final Deque<Supplier<? extends RuntimeException>> injectedFailures = new ArrayDeque<>();
  private final AtomicInteger clientsOpened = new AtomicInteger();

  public InMemoryStore() {
    this(Clock.systemUTC());
  }

  public InMemoryStore(final Clock clock) {
    if (clock == null) throw new IllegalArgumentException("clock is required");
    this.clock = clock;
  }

  /**
   * Returns a factory that opens clients against this store.
   *
   * @return client factory for a connection pool
   */
  public StoreClientFactory clientFactory() {
    return this::openClient;
  }

  public InMemoryStoreClient openClient() {
    clientsOpened.incrementAndGet();
    return new InMemoryStoreClient(this);
  }

  public int clientsOpened() {
    return clientsOpened.get();
  }

  /**
   * Makes the next {@code count} store calls fail with the supplied exception before touching any
   * state.
   *
   * @param count number of calls to fail
   * @param failure creates the exception to throw
   */
  public synchronized void failNext(
      final int count, final Supplier<? extends RuntimeException> failure) {
    for (int i = 0; i < count; i++) injectedFailures.add(failure);
  }

  /**
   * Number of calls of one store operation, failed calls included.
   *
   * @param operation operation name, e.g. {@code addVersion}
   * @return call count
   */
  public long callCount(final String operation) {
    final var count = callCounts.get(operation);
    return count == null ? 0 : count.get();
  }

  public synchronized int entityCount() {
    return entities.size();
  }

  synchronized Entity createEntity(
      final EntityPath path, final Map<String, String> labels, final ParameterFormat format) {
    enter("createEntity");
    final var key = path.toString();
    if (entities.containsKey(key)) throw exists(key + " already exists");
    final var entity = new Entity(path, labels, format, clock.instant());
    entities.put(key, new StoredEntity(entity));
    logger.log(DEBUG, "Created {0}", key);
    return entity;
  }

  synchronized Entity getEntity(final EntityPath path) {
    enter("getEntity");
    return require(path).entity;
  }

  synchronized Page<Entity> listEntities(
      final EntityCollection collection,
      final ListFilter filter,
      final String pageToken,
      final int pageSize) {
    enter("listEntities");
    if (pageSize < 1) throw invalidParameter("MaxResults must be positive");
    final var prefix = collection + "/";
    final var after = pageToken == null ? prefix : prefix + decode(pageToken);

    final var items = new ArrayList<Entity>();
    String last = null;
    for (final var entry : entities.tailMap(after, pageToken == null).entrySet()) {
      if (!entry.getKey().startsWith(prefix)) break;
      if (items.size() == pageSize) {
        return new Page<>(items, encode(last));
      }
      final var entity = entry.getValue().entity;
      if (filter.matches(entity.path().entityId(), entity.labels())) items.add(entity);
      last = entity.path().entityId();
    }
    return new Page<>(items, null);
  }

  synchronized void deleteEntity(final EntityPath path) {
    enter("deleteEntity");
    require(path);
    entities.remove(path.toString());
    logger.log(DEBUG, "Deleted {0}", path);
  }

  synchronized Version addVersion(
      final EntityPath path, final byte[] payload, final String customName) {
    enter("addVersion");
    final var stored = require(path);
    if (payload == null) throw invalidParameter("Payload is required");

    final String versionId;
    if (customName == null) {
      versionId = Long.toString(++stored.sequence);
    } else {
      if (!VersionNames.isCustomName(customName))
        throw invalidParameter("Invalid version name: " + customName);
      if (stored.find(customName) != null)
        throw exists("Version " + customName + " of " + path + " already exists");
      versionId = customName;
    }

    final var version =
        new Version(
            path, versionId, VersionState.ENABLED, payload, clock.instant(), customName != null);
    stored.versions.add(version);
    return version;
  }

  synchronized Version getVersion(final EntityPath path, final String versionId) {
    enter("getVersion");
    return requireVersion(path, versionId);
  }

  synchronized Version updateVersionState(
      final EntityPath path, final String versionId, final VersionState state) {
    enter("updateVersionState");
    if (state == VersionState.DESTROYED)
      throw invalidParameter("Use destroyVersion to destroy a version");
    final var current = requireVersion(path, versionId);
    if (current.state() == VersionState.DESTROYED)
      throw invalidRequest("Version " + versionId + " of " + path + " is destroyed");
    return replace(path, current.withState(state));
  }

  synchronized Version destroyVersion(final EntityPath path, final String versionId) {
    enter("destroyVersion");
    final var current = requireVersion(path, versionId);
    if (current.state() == VersionState.DESTROYED)
      throw invalidRequest("Version " + versionId + " of " + path + " is destroyed");
    return replace(path, current.withState(VersionState.DESTROYED));
  }

  synchronized Page<Version> listVersions(
      final EntityPath path, final String pageToken, final int pageSize) {
    enter("listVersions");
    if (pageSize < 1) throw invalidParameter("MaxResults must be positive");
    final var versions = require(path).versions;
    final int from;
    try {
      from = pageToken == null ? 0 : Integer.parseInt(decode(pageToken));
    } catch (final NumberFormatException e) {
      throw invalidToken(pageToken);
    }
    if (from < 0 || from > versions.size()) throw invalidToken(pageToken);

    final var to = Math.min(versions.size(), from + pageSize);
    final var next = to < versions.size() ? encode(Integer.toString(to)) : null;
    final var items = new ArrayList<Version>(to - from);
    for (final var version : versions.subList(from, to)) items.add(version.withoutPayload());
    return new Page<>(items, next);
  }

  private Version replace(final EntityPath path, final Version updated) {
    final var versions = require(path).versions;
    for (int i = 0; i < versions.size(); i++) {
      if (versions.get(i).versionId().equals(updated.versionId())) {
        versions.set(i, updated);
        return updated;
      }
    }
    throw notFound("Version " + updated.versionId() + " of " + path + " not found");
  }

  private StoredEntity require(final EntityPath path) {
    final var stored = entities.get(path.toString());
    if (stored == null) throw notFound(path + " not found");
    return stored;
  }

  private Version requireVersion(final EntityPath path, final String versionId) {
    final var version = require(path).find(versionId);
    if (version == null)
      throw notFound("Version " + versionId + " of " + path + " not found");
    return version;
  }

  private void enter(final String operation) {
    callCounts.computeIfAbsent(operation, k -> new AtomicLong()).incrementAndGet();
    final var failure = injectedFailures.poll();
    if (failure != null) throw failure.get();
  }

  private static String encode(final String value) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }

  private static String decode(final String token) {
    try {
      return new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
    } catch (final IllegalArgumentException e) {
      throw invalidToken(token);
    }
  }

  private static final class StoredEntity {
    private final Entity entity;
    private final List<Version> versions = new ArrayList<>();
    private long sequence;

    private StoredEntity(final Entity entity) {
      this.entity = entity;
    }

    private Version find(final String versionId) {
      for (final var version : versions) {
        if (version.versionId().equals(versionId)) return version;
      }
      return null;
    }
  }
}
