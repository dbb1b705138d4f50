package com.example.resilientsecrets.core.service;

import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.listing.BatchFetchResult;
import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityKind;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.version.VersionNames;
import java.util.Collection;
import java.util.Map;

/**
 * Access to secrets: opaque, versioned byte payloads.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * try (var secrets =
 *     SecretService.builder()
 *         .config(StoreAccessConfig.fromEnvironment())
 *         .factory(AwsStoreClientFactory.fromEnvironment())
 *         .build()) {
 *   secrets.create("db-pass", "s3cr3t".getBytes(UTF_8), Map.of("team", "payments"));
 *   var password = secrets.get("db-pass").payloadAsString();
 * }
 * }</pre>
 */
public final class SecretService extends EntityService {

  /** Largest secret payload in bytes. */
  public static final int MAX_PAYLOAD_BYTES = 64 * 1024;

  private SecretService(final Components components) {
    super(EntityKind.SECRET, "secret", components);
  }

  public static Builder<SecretService> builder() {
    return new Builder<>(SecretService::new);
  }

  /**
   * Creates a secret without versions.
   *
   * @param secretId secret id
   * @param labels user labels, may be null
   * @return the created secret
   * @throws StoreAccessException {@code ALREADY_EXISTS} if the secret exists
   */
  public Entity create(final String secretId, final Map<String, String> labels) {
    return timed("create", target(secretId), () -> createEntity(path(secretId), labels, null));
  }

  /**
   * Creates a secret and adds its first version.
   *
   * <p>The payload is validated before the secret is created. If adding the version fails, the
   * secret stays in place without versions.
   *
   * @param secretId secret id
   * @param payload first payload
   * @param labels user labels, may be null
   * @return the first version
   */
  public Version create(
      final String secretId, final byte[] payload, final Map<String, String> labels) {
    return timed(
        "create",
        target(secretId),
        () -> {
          validatePayload(payload);
          final var path = path(secretId);
          createEntity(path, labels, null);
          return appendVersion(path, payload, null);
        });
  }

  /**
   * Adds a version with a store-assigned id. The new version is enabled and becomes {@code
   * latest}.
   *
   * @param secretId secret id
   * @param payload payload, 1 byte to 64 KiB
   * @return the new version
   */
  public Version addVersion(final String secretId, final byte[] payload) {
    return addVersion(secretId, null, payload);
  }

  /**
   * Adds a version under a custom name. Names are never reused, even after the named version is
   * destroyed.
   *
   * @param secretId secret id
   * @param versionName custom name, or null for a store-assigned id
   * @param payload payload, 1 byte to 64 KiB
   * @return the new version
   * @throws StoreAccessException {@code ALREADY_EXISTS} if the name was ever used
   */
  public Version addVersion(final String secretId, final String versionName, final byte[] payload) {
    return timed(
        "addVersion",
        target(secretId),
        () -> {
          validatePayload(payload);
          return appendVersion(path(secretId), payload, versionName);
        });
  }

  /**
   * Reads the latest enabled version.
   *
   * @param secretId secret id
   * @return version with payload
   * @throws StoreAccessException {@code NOT_FOUND} if no version is enabled
   */
  public Version get(final String secretId) {
    return timed(
        "get", target(secretId), () -> fetchVersion(path(secretId), VersionNames.LATEST));
  }

  /**
   * Reads a version by id or {@code latest}.
   *
   * @param secretId secret id
   * @param versionId version id or {@link VersionNames#LATEST}
   * @return version with payload
   * @throws StoreAccessException {@code NOT_FOUND} if the version is absent, disabled or destroyed
   */
  public Version get(final String secretId, final String versionId) {
    return timed("get", target(secretId), () -> fetchVersion(path(secretId), versionId));
  }

  /**
   * Reads the latest enabled version of many secrets. Failures are reported per id.
   *
   * @param secretIds secret ids
   * @return versions and failures by id
   */
  public BatchFetchResult<Version> getAll(final Collection<String> secretIds) {
    return timed(
        "getAll",
        collection,
        () ->
            listing.batchGet(
                collection, secretIds, path -> fetchVersion(path, VersionNames.LATEST)));
  }

  private static void validatePayload(final byte[] payload) {
    if (payload == null || payload.length == 0)
      throw StoreAccessException.invalidArgument("Secret payload must not be empty");
    if (payload.length > MAX_PAYLOAD_BYTES)
      throw StoreAccessException.invalidArgument(
          "Secret payload is %d bytes, limit is %d".formatted(payload.length, MAX_PAYLOAD_BYTES));
  }
}
