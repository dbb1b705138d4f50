package com.example.resilientsecrets.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class EntityPathTest {

  @Test
  void shouldRenderAndParse() {
    final var path = new EntityPath(EntityKind.PARAMETER, "acme", "eu-west-1", "feature-flags");
    final var rendered = "projects/acme/locations/eu-west-1/parameters/feature-flags";

    assertEquals(rendered, path.toString());
    assertEquals(path, EntityPath.parse(rendered));
    assertEquals("projects/acme/locations/eu-west-1/parameters", path.collection().toString());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "projects/acme/locations/global/keys/x",
        "projects/acme/locations/global/secrets/",
        "projects/acme/locations/global/secrets/a/b",
        "projects/acme/locations/global/secrets/has space"
      })
  void shouldRejectMalformedPaths(final String rendered) {
    assertThrows(IllegalArgumentException.class, () -> EntityPath.parse(rendered));
  }

  @Test
  void shouldValidateIds() {
    final var collection = new EntityCollection(EntityKind.SECRET, "acme", "global");

    assertDoesNotThrow(() -> collection.path("A_b-9"));
    assertDoesNotThrow(() -> collection.path("x".repeat(255)));
    assertThrows(IllegalArgumentException.class, () -> collection.path("x".repeat(256)));
    assertThrows(IllegalArgumentException.class, () -> collection.path("db/pass"));
    assertThrows(IllegalArgumentException.class, () -> collection.path(null));
    assertThrows(
        IllegalArgumentException.class, () -> new EntityCollection(null, "acme", "global"));
  }

  @Test
  @DisplayName("Version keys of one entity share a prefix no other entity has")
  void versionKeysShouldBeScoped() {
    final var collection = new EntityCollection(EntityKind.SECRET, "acme", "global");

    final var prefix = collection.path("db").versionKey("");

    assertTrue(collection.path("db").versionKey("1").startsWith(prefix));
    assertFalse(collection.path("db-replica").versionKey("1").startsWith(prefix));
  }

  @Test
  @DisplayName("Version toString never renders the payload")
  void versionToStringShouldRedact() {
    final var version =
        new Version(
            new EntityCollection(EntityKind.SECRET, "acme", "global").path("db"),
            "1",
            VersionState.ENABLED,
            "s3cr3t".getBytes(),
            Instant.EPOCH,
            false);

    assertFalse(version.toString().contains("s3cr3t"));
  }
}
