package com.example.resilientsecrets.core.service;

import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.listing.BatchFetchResult;
import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityKind;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.version.VersionNames;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;

/**
 * Access to parameters: configuration values with a declared {@link ParameterFormat} and
 * optionally named versions.
 *
 * <p>Data is checked against the declared format before it is sent to the store, so a malformed
 * value never creates a version.
 *
 * <pre>{@code
 * parameters.create("feature-flags", ParameterFormat.JSON, Map.of());
 * parameters.addVersion("feature-flags", "v-initial", Map.of("checkout", true));
 * var flags = parameters.getValue("feature-flags").as(FeatureFlags.class);
 * }</pre>
 */
public final class ParameterService extends EntityService {

  private ParameterService(final Components components) {
    super(EntityKind.PARAMETER, "parameter", components);
  }

  public static Builder<ParameterService> builder() {
    return new Builder<>(ParameterService::new);
  }

  /**
   * Creates a parameter without versions.
   *
   * @param parameterId parameter id
   * @param format declared format, null for {@link ParameterFormat#UNFORMATTED}
   * @param labels user labels, may be null
   * @return the created parameter
   */
  public Entity create(
      final String parameterId, final ParameterFormat format, final Map<String, String> labels) {
    final var effective = format == null ? ParameterFormat.UNFORMATTED : format;
    return timed(
        "create", target(parameterId), () -> createEntity(path(parameterId), labels, effective));
  }

  /**
   * Adds a version after checking {@code data} against the parameter's declared format.
   *
   * <p>The declared format is read from the store first, so malformed data costs one {@code
   * getEntity} round trip but never reaches {@code addVersion}. Callers that know the format use
   * {@link #addVersion(String, String, String, ParameterFormat)}, which rejects malformed data
   * without any remote call.
   *
   * @param parameterId parameter id
   * @param versionName custom version name, or null for a store-assigned id
   * @param data UTF-8 data, at most 1 MiB
   * @return the new version
   * @throws StoreAccessException {@code INVALID_ARGUMENT} if the data does not parse in the
   *     declared format; {@code ALREADY_EXISTS} if the name was ever used
   */
  public Version addVersion(final String parameterId, final String versionName, final String data) {
    return timed(
        "addVersion",
        target(parameterId),
        () -> {
          final var path = path(parameterId);
          ParameterFormats.validate(declaredFormat(path), data);
          return appendVersion(path, data.getBytes(StandardCharsets.UTF_8), versionName);
        });
  }

  /**
   * Adds a version whose data is validated locally as {@code format} before any remote call, then
   * checked against the parameter's declared format.
   *
   * @param parameterId parameter id
   * @param versionName custom version name, or null for a store-assigned id
   * @param data UTF-8 data, at most 1 MiB
   * @param format format the caller claims {@code data} is in
   * @return the new version
   */
  public Version addVersion(
      final String parameterId,
      final String versionName,
      final String data,
      final ParameterFormat format) {
    return timed(
        "addVersion",
        target(parameterId),
        () -> {
          ParameterFormats.validate(format, data);
          final var path = path(parameterId);
          final var declared = declaredFormat(path);
          if (declared != format)
            throw StoreAccessException.invalidArgument(
                "%s is declared %s, data is %s".formatted(path, declared, format));
          return appendVersion(path, data.getBytes(StandardCharsets.UTF_8), versionName);
        });
  }

  /**
   * Adds a version holding {@code value} serialized in the parameter's declared format.
   *
   * @param parameterId parameter id
   * @param versionName custom version name, or null for a store-assigned id
   * @param value structured value, e.g. a map or a bean
   * @return the new version
   */
  public Version addVersion(
      final String parameterId, final String versionName, final Object value) {
    return timed(
        "addVersion",
        target(parameterId),
        () -> {
          final var path = path(parameterId);
          final var format = declaredFormat(path);
          final var data = ParameterFormats.write(format, value);
          ParameterFormats.validate(format, data);
          return appendVersion(path, data.getBytes(StandardCharsets.UTF_8), versionName);
        });
  }

  public Version get(final String parameterId) {
    return timed(
        "get", target(parameterId), () -> fetchVersion(path(parameterId), VersionNames.LATEST));
  }

  /**
   * Reads a version by id, custom name or {@code latest}.
   *
   * @param parameterId parameter id
   * @param versionId version id or {@link VersionNames#LATEST}
   * @return version with payload
   */
  public Version get(final String parameterId, final String versionId) {
    return timed("get", target(parameterId), () -> fetchVersion(path(parameterId), versionId));
  }

  public ParameterValue getValue(final String parameterId) {
    return timed(
        "getValue", target(parameterId), () -> readValue(path(parameterId), VersionNames.LATEST));
  }

  /**
   * Reads a version's data with the parameter's declared format.
   *
   * @param parameterId parameter id
   * @param versionId version id or {@link VersionNames#LATEST}
   * @return data and format
   */
  public ParameterValue getValue(final String parameterId, final String versionId) {
    return timed("getValue", target(parameterId), () -> readValue(path(parameterId), versionId));
  }

  /**
   * Reads the latest value of many parameters. Failures are reported per id.
   *
   * @param parameterIds parameter ids
   * @return values and failures by id
   */
  public BatchFetchResult<ParameterValue> getAll(final Collection<String> parameterIds) {
    return timed(
        "getAll",
        collection,
        () ->
            listing.batchGet(
                collection, parameterIds, path -> readValue(path, VersionNames.LATEST)));
  }

  private ParameterValue readValue(final EntityPath path, final String versionId) {
    final var format = declaredFormat(path);
    final var version = fetchVersion(path, versionId);
    return new ParameterValue(
        path, version.versionId(), format, version.payloadAsString(), version.createTime());
  }

  private ParameterFormat declaredFormat(final EntityPath path) {
    final var format = fetchEntity(path).format();
    return format == null ? ParameterFormat.UNFORMATTED : format;
  }
}
