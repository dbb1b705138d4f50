package com.example.resilientsecrets.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One version of a secret or parameter.
 *
 * <p>The payload is absent (null) once the version is {@link VersionState#DESTROYED}. {@link
 * #toString()} never renders payload bytes.
 *
 * @param path owning entity
 * @param versionId store-assigned sequence number or custom name
 * @param state lifecycle state
 * @param payload payload bytes, null when destroyed
 * @param createTime creation time reported by the store
 * @param customName whether {@code versionId} was chosen by the caller
 */
public record Version(
    EntityPath path,
    String versionId,
    VersionState state,
    byte[] payload,
    Instant createTime,
    boolean customName) {

  public Version {
    payload = payload == null ? null : payload.clone();
  }

  @Override
  public byte[] payload() {
    return payload == null ? null : payload.clone();
  }

  /**
   * Decodes the payload as UTF-8 text.
   *
   * @return payload text, or null when the payload is absent
   */
  public String payloadAsString() {
    return payload == null ? null : new String(payload, StandardCharsets.UTF_8);
  }

  /**
   * Returns a copy of this version in a different state. Destroyed copies drop the payload.
   *
   * @param newState target state
   * @return updated copy
   */
  public Version withState(final VersionState newState) {
    final var newPayload = newState == VersionState.DESTROYED ? null : payload;
    return new Version(path, versionId, newState, newPayload, createTime, customName);
  }

  /**
   * Returns a copy without payload, as returned by version listings.
   *
   * @return metadata-only copy
   */
  public Version withoutPayload() {
    return new Version(path, versionId, state, null, createTime, customName);
  }

  @Override
  public boolean equals(final Object other) {
    return other instanceof Version v
        && path.equals(v.path)
        && versionId.equals(v.versionId)
        && state == v.state
        && Arrays.equals(payload, v.payload)
        && Objects.equals(createTime, v.createTime)
        && customName == v.customName;
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, versionId, state, createTime, customName);
  }

  @Override
  public String toString() {
    return "Version[path=%s, versionId=%s, state=%s, payload=%s, createTime=%s, customName=%s]"
        .formatted(
            path,
            versionId,
            state,
            payload == null ? "<none>" : "<redacted " + payload.length + " bytes>",
            createTime,
            customName);
  }
}
