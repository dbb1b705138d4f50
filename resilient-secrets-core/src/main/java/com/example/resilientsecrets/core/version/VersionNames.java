package com.example.resilientsecrets.core.version;

import com.example.resilientsecrets.core.error.StoreAccessException;
import java.util.regex.Pattern;

/**
 * Version id rules shared by both stores.
 *
 * <p>Store-assigned ids are decimal sequence numbers. Custom names must start with a letter, so
 * they can never collide with a store-assigned id, and may not be the {@code latest} alias.
 */
public final class VersionNames {

  public static final String LATEST = "latest";

  private static final Pattern CUSTOM_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_-]{0,62}");
  private static final Pattern SEQUENCE = Pattern.compile("[1-9][0-9]{0,18}");

  private VersionNames() {}

  public static boolean isCustomName(final String versionId) {
    return versionId != null
        && !LATEST.equals(versionId)
        && CUSTOM_NAME.matcher(versionId).matches();
  }

  public static boolean isSequence(final String versionId) {
    return versionId != null && SEQUENCE.matcher(versionId).matches();
  }

  /**
   * Validates a caller-chosen version name.
   *
   * @param name proposed name
   * @throws StoreAccessException with {@code INVALID_ARGUMENT} if the name is not allowed
   */
  public static void requireCustomName(final String name) {
    if (!isCustomName(name))
      throw StoreAccessException.invalidArgument(
          "Invalid version name '%s': must match [A-Za-z][A-Za-z0-9_-]{0,62} and not be '%s'"
              .formatted(name, LATEST));
  }

  /**
   * Validates a version reference: a sequence number, a custom name or, when allowed, {@code
   * latest}.
   *
   * @param versionId reference to validate
   * @param allowLatest whether the {@code latest} alias is accepted
   * @throws StoreAccessException with {@code INVALID_ARGUMENT} if the reference is malformed
   */
  public static void requireVersionRef(final String versionId, final boolean allowLatest) {
    if (LATEST.equals(versionId)) {
      if (allowLatest) return;
      throw StoreAccessException.invalidArgument(
          "The '%s' alias cannot be used here; name a concrete version".formatted(LATEST));
    }
    if (!isSequence(versionId) && !isCustomName(versionId))
      throw StoreAccessException.invalidArgument("Invalid version id '%s'".formatted(versionId));
  }
}
