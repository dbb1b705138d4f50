package com.example.resilientsecrets.core.store.aws;

import static com.example.resilientsecrets.core.store.SecretsManagerErrors.exists;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.invalidParameter;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.invalidRequest;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.invalidToken;
import static com.example.resilientsecrets.core.store.SecretsManagerErrors.notFound;
import static java.lang.System.Logger.Level.DEBUG;

import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityCollection;
import com.example.resilientsecrets.core.model.EntityKind;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.model.VersionState;
import com.example.resilientsecrets.core.store.ListFilter;
import com.example.resilientsecrets.core.store.Page;
import com.example.resilientsecrets.core.store.StoreClient;
import com.example.resilientsecrets.core.version.VersionNames;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DeleteSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.Filter;
import software.amazon.awssdk.services.secretsmanager.model.FilterNameStringType;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretVersionIdsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.SecretVersionsListEntry;
import software.amazon.awssdk.services.secretsmanager.model.Tag;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretVersionStageRequest;

/**
 * {@link StoreClient} backed by AWS Secrets Manager.
 *
 * <p>Entities map to secrets named {@code {project}/{location}/{collection}/{entityId}}; labels
 * map to tags and the parameter format is kept in the {@value #FORMAT_TAG} tag. Secrets Manager has
 * no per-version lifecycle, so it is encoded in staging labels:
 *
 * <ul>
 *   <li>{@code V_{id}} names the version and stays attached for its whole lifetime
 *   <li>{@code DISABLED_{id}} marks a disabled version
 *   <li>{@code DESTROYED_{id}} marks a destroyed version, whose payload is never returned again
 * </ul>
 *
 * <p>Secrets Manager cannot purge a single version, so a destroyed payload stays in the service
 * until the secret is deleted. Adds use a client request token derived from the secret and version
 * id, which makes a replayed add of a custom-named version succeed instead of conflicting.
 */
public final class AwsSecretStoreClient implements StoreClient {

  private static final Logger logger = System.getLogger(AwsSecretStoreClient.class.getName());

  static final String FORMAT_TAG = "resilient-secrets:format";
  static final String VERSION_PREFIX = "V_";
  static final String DISABLED_PREFIX = "DISABLED_";
  static final String DESTROYED_PREFIX = "DESTROYED_";

  // Secrets Manager rejects larger ListSecrets pages.
  private static final int MAX_SERVICE_PAGE = 100;

  private final SecretsManagerClient client;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public AwsSecretStoreClient(final SecretsManagerClient client) {
    if (client == null) throw new IllegalArgumentException("client is required");
    this.client = client;
  }

  @Override
  public Entity createEntity(
      final EntityPath path, final Map<String, String> labels, final ParameterFormat format) {
    final var tags = new ArrayList<Tag>();
    if (labels != null)
      labels.forEach((k, v) -> tags.add(Tag.builder().key(k).value(v).build()));
    if (format != null) tags.add(Tag.builder().key(FORMAT_TAG).value(format.name()).build());

    client.createSecret(CreateSecretRequest.builder().name(secretName(path)).tags(tags).build());
    logger.log(DEBUG, "Created secret {0}", secretName(path));
    return getEntity(path);
  }

  @Override
  public Entity getEntity(final EntityPath path) {
    final var response =
        client.describeSecret(DescribeSecretRequest.builder().secretId(secretName(path)).build());
    return toEntity(path, response.tags(), response.createdDate());
  }

  @Override
  public Page<Entity> listEntities(
      final EntityCollection collection,
      final ListFilter filter,
      final String pageToken,
      final int pageSize) {
    final var effective = filter == null ? ListFilter.ALL : filter;
    final var prefix = collectionPrefix(collection);
    final var namePrefix = effective.idPrefix() == null ? prefix : prefix + effective.idPrefix();

    final var response =
        client.listSecrets(
            ListSecretsRequest.builder()
                .filters(Filter.builder().key(FilterNameStringType.NAME).values(namePrefix).build())
                .maxResults(Math.min(pageSize, MAX_SERVICE_PAGE))
                .nextToken(pageToken)
                .build());

    final var items = new ArrayList<Entity>();
    for (final var entry : response.secretList()) {
      // The name filter matches by prefix but also matches deeper names.
      final var name = entry.name();
      if (name == null || !name.startsWith(prefix) || name.indexOf('/', prefix.length()) >= 0)
        continue;
      final var path = collection.path(name.substring(prefix.length()));
      final var entity = toEntity(path, entry.tags(), entry.createdDate());
      if (effective.matches(path.entityId(), entity.labels())) items.add(entity);
    }
    return new Page<>(items, response.nextToken());
  }

  @Override
  public void deleteEntity(final EntityPath path) {
    client.deleteSecret(
        DeleteSecretRequest.builder()
            .secretId(secretName(path))
            .forceDeleteWithoutRecovery(true)
            .build());
  }

  @Override
  public Version addVersion(final EntityPath path, final byte[] payload, final String customName) {
    if (customName != null && !VersionNames.isCustomName(customName))
      throw invalidParameter("Invalid version name: " + customName);

    final var existing = versionEntries(path);
    final var versionId = customName != null ? customName : nextSequence(existing);
    final var token = requestToken(path, versionId);

    for (final var entry : existing) {
      if (!versionId.equals(versionIdOf(entry))) continue;
      if (token.equals(entry.versionId())) return getVersion(path, versionId);
      throw exists("Version " + versionId + " of " + path + " already exists");
    }

    client.putSecretValue(
        PutSecretValueRequest.builder()
            .secretId(secretName(path))
            .clientRequestToken(token)
            .secretBinary(SdkBytes.fromByteArray(payload))
            .versionStages(VERSION_PREFIX + versionId)
            .build());
    return getVersion(path, versionId);
  }

  @Override
  public Version getVersion(final EntityPath path, final String versionId) {
    final var response =
        client.getSecretValue(
            GetSecretValueRequest.builder()
                .secretId(secretName(path))
                .versionStage(VERSION_PREFIX + versionId)
                .build());
    final var state = stateOf(versionId, response.versionStages());
    final byte[] payload;
    if (state == VersionState.DESTROYED) {
      payload = null;
    } else if (response.secretBinary() != null) {
      payload = response.secretBinary().asByteArray();
    } else if (response.secretString() != null) {
      payload = response.secretString().getBytes(StandardCharsets.UTF_8);
    } else {
      payload = new byte[0];
    }
    return new Version(
        path,
        versionId,
        state,
        payload,
        response.createdDate(),
        VersionNames.isCustomName(versionId));
  }

  @Override
  public Version updateVersionState(
      final EntityPath path, final String versionId, final VersionState state) {
    if (state == VersionState.DESTROYED)
      throw invalidParameter("Use destroyVersion to destroy a version");
    final var current = requireEntry(path, versionId);
    final var currentState = stateOf(versionId, current.versionStages());
    if (currentState == VersionState.DESTROYED)
      throw invalidRequest(
          "Version " + versionId + " of " + path + " is destroyed");

    if (currentState != state) {
      final var request =
          UpdateSecretVersionStageRequest.builder()
              .secretId(secretName(path))
              .versionStage(DISABLED_PREFIX + versionId);
      if (state == VersionState.DISABLED) request.moveToVersionId(current.versionId());
      else request.removeFromVersionId(current.versionId());
      client.updateSecretVersionStage(request.build());
    }
    return getVersion(path, versionId);
  }

  @Override
  public Version destroyVersion(final EntityPath path, final String versionId) {
    final var current = requireEntry(path, versionId);
    if (stateOf(versionId, current.versionStages()) == VersionState.DESTROYED)
      throw invalidRequest(
          "Version " + versionId + " of " + path + " is destroyed");

    client.updateSecretVersionStage(
        UpdateSecretVersionStageRequest.builder()
            .secretId(secretName(path))
            .versionStage(DESTROYED_PREFIX + versionId)
            .moveToVersionId(current.versionId())
            .build());
    return getVersion(path, versionId);
  }

  /**
   * Lists versions sorted by creation time. Secrets Manager returns versions in no defined order,
   * so every call reads all version ids and pages over the sorted result.
   */
  @Override
  public Page<Version> listVersions(
      final EntityPath path, final String pageToken, final int pageSize) {
    final var entries = versionEntries(path);
    entries.sort(
        Comparator.comparing(
            SecretVersionsListEntry::createdDate,
            Comparator.nullsFirst(Comparator.naturalOrder())));

    final int from = decodeOffset(pageToken, entries.size());
    final var to = Math.min(entries.size(), from + pageSize);
    final var items = new ArrayList<Version>(to - from);
    for (final var entry : entries.subList(from, to)) {
      final var versionId = versionIdOf(entry);
      final var state = stateOf(versionId, entry.versionStages());
      // Listing returns metadata only; payloads are read with getVersion.
      items.add(
          new Version(
              path,
              versionId,
              state,
              null,
              entry.createdDate(),
              VersionNames.isCustomName(versionId)));
    }
    final var next = to < entries.size() ? encodeOffset(to) : null;
    return new Page<>(items, next);
  }

  @Override
  public boolean isAlive() {
    return !closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) client.close();
  }

  static String secretName(final EntityPath path) {
    return collectionPrefix(path.collection()) + path.entityId();
  }

  static String requestToken(final EntityPath path, final String versionId) {
    return UUID.nameUUIDFromBytes(
            (secretName(path) + "#" + versionId).getBytes(StandardCharsets.UTF_8))
        .toString();
  }

  private static String collectionPrefix(final EntityCollection collection) {
    return collection.project()
        + "/"
        + collection.location()
        + "/"
        + collection.kind().collection()
        + "/";
  }

  private List<SecretVersionsListEntry> versionEntries(final EntityPath path) {
    final var entries = new ArrayList<SecretVersionsListEntry>();
    String token = null;
    do {
      final var response =
          client.listSecretVersionIds(
              ListSecretVersionIdsRequest.builder()
                  .secretId(secretName(path))
                  .includeDeprecated(true)
                  .maxResults(MAX_SERVICE_PAGE)
                  .nextToken(token)
                  .build());
      for (final var entry : response.versions()) {
        if (versionIdOf(entry) != null) entries.add(entry);
      }
      token = response.nextToken();
    } while (token != null && !token.isEmpty());
    return entries;
  }

  private SecretVersionsListEntry requireEntry(final EntityPath path, final String versionId) {
    for (final var entry : versionEntries(path)) {
      if (versionId.equals(versionIdOf(entry))) return entry;
    }
    throw notFound("Version " + versionId + " of " + path + " not found");
  }

  private static String nextSequence(final List<SecretVersionsListEntry> entries) {
    long max = 0;
    for (final var entry : entries) {
      final var id = versionIdOf(entry);
      if (VersionNames.isSequence(id)) max = Math.max(max, Long.parseLong(id));
    }
    return Long.toString(max + 1);
  }

  private static String versionIdOf(final SecretVersionsListEntry entry) {
    for (final var stage : entry.versionStages()) {
      if (stage.startsWith(VERSION_PREFIX)) return stage.substring(VERSION_PREFIX.length());
    }
    return null;
  }

  private static VersionState stateOf(final String versionId, final List<String> stages) {
    if (stages.contains(DESTROYED_PREFIX + versionId)) return VersionState.DESTROYED;
    if (stages.contains(DISABLED_PREFIX + versionId)) return VersionState.DISABLED;
    return VersionState.ENABLED;
  }

  private static Entity toEntity(
      final EntityPath path, final List<Tag> tags, final Instant createdDate) {
    final var labels = new HashMap<String, String>();
    ParameterFormat format = null;
    for (final var tag : tags) {
      if (FORMAT_TAG.equals(tag.key())) format = ParameterFormat.valueOf(tag.value());
      else labels.put(tag.key(), tag.value());
    }
    if (format == null && path.kind() == EntityKind.PARAMETER) format = ParameterFormat.UNFORMATTED;
    return new Entity(path, labels, format, createdDate);
  }

  private static String encodeOffset(final int offset) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(Integer.toString(offset).getBytes(StandardCharsets.UTF_8));
  }

  private static int decodeOffset(final String token, final int size) {
    if (token == null) return 0;
    try {
      final var decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
      final var offset = Integer.parseInt(decoded);
      if (offset < 0 || offset > size) throw invalidToken(token);
      return offset;
    } catch (final IllegalArgumentException e) {
      throw invalidToken(token);
    }
  }
}
