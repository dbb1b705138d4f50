package com.example.resilientsecrets.core.store.aws;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.ExceptionMapper;
import com.example.resilientsecrets.core.model.EntityCollection;
import com.example.resilientsecrets.core.model.EntityKind;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.model.VersionState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretVersionIdsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretVersionIdsResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsResponse;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretVersionsListEntry;
import software.amazon.awssdk.services.secretsmanager.model.Tag;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretVersionStageRequest;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class AwsSecretStoreClientTest {

  private static final EntityCollection SECRETS =
      new EntityCollection(EntityKind.SECRET, "test-project", "global");
  private static final EntityCollection PARAMETERS =
      new EntityCollection(EntityKind.PARAMETER, "test-project", "global");
  private static final String DB_PASS = "test-project/global/secrets/db-pass";
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private SecretsManagerClient sdk;
  private AwsSecretStoreClient client;

  @BeforeEach
  void setUp() {
    sdk = mock(SecretsManagerClient.class);
    client = new AwsSecretStoreClient(sdk);
  }

  private static SecretVersionsListEntry entry(
      final String awsId, final Instant created, final String... stages) {
    return SecretVersionsListEntry.builder()
        .versionId(awsId)
        .createdDate(created)
        .versionStages(stages)
        .build();
  }

  private void versions(final SecretVersionsListEntry... entries) {
    when(sdk.listSecretVersionIds(any(ListSecretVersionIdsRequest.class)))
        .thenReturn(ListSecretVersionIdsResponse.builder().versions(entries).build());
  }

  private void value(final String versionId, final String payload, final String... stages) {
    when(sdk.getSecretValue(
            argThat(
                (GetSecretValueRequest r) ->
                    r != null && ("V_" + versionId).equals(r.versionStage()))))
        .thenReturn(
            GetSecretValueResponse.builder()
                .name(DB_PASS)
                .secretBinary(SdkBytes.fromString(payload, UTF_8))
                .versionStages(stages)
                .createdDate(T0)
                .build());
  }

  @Test
  @DisplayName("Secret names follow project/location/collection/entityId")
  void shouldNameSecrets() {
    assertEquals(DB_PASS, AwsSecretStoreClient.secretName(SECRETS.path("db-pass")));
    assertEquals(
        "test-project/global/parameters/flags",
        AwsSecretStoreClient.secretName(PARAMETERS.path("flags")));
  }

  @Test
  @DisplayName("Request tokens are stable per secret and version")
  void shouldDeriveStableTokens() {
    final var path = SECRETS.path("db-pass");
    assertEquals(
        AwsSecretStoreClient.requestToken(path, "v1"),
        AwsSecretStoreClient.requestToken(path, "v1"));
    assertNotEquals(
        AwsSecretStoreClient.requestToken(path, "v1"),
        AwsSecretStoreClient.requestToken(path, "v2"));
  }

  @Nested
  @DisplayName("Entities")
  class Entities {

    @Test
    @DisplayName("Labels become tags and the format is kept in its own tag")
    void createShouldTag() {
      when(sdk.createSecret(any(CreateSecretRequest.class)))
          .thenReturn(CreateSecretResponse.builder().name(DB_PASS).build());
      when(sdk.describeSecret(any(DescribeSecretRequest.class)))
          .thenReturn(
              DescribeSecretResponse.builder()
                  .name("test-project/global/parameters/flags")
                  .createdDate(T0)
                  .tags(
                      Tag.builder().key("env").value("prod").build(),
                      Tag.builder().key(AwsSecretStoreClient.FORMAT_TAG).value("YAML").build())
                  .build());

      final var entity =
          client.createEntity(
              PARAMETERS.path("flags"), Map.of("env", "prod"), ParameterFormat.YAML);

      verify(sdk)
          .createSecret(
              argThat(
                  (CreateSecretRequest r) ->
                      r.name().equals("test-project/global/parameters/flags")
                          && r.tags().size() == 2));
      assertEquals(Map.of("env", "prod"), entity.labels());
      assertEquals(ParameterFormat.YAML, entity.format());
      assertEquals(T0, entity.createTime());
    }

    @Test
    @DisplayName("Listing skips secrets nested below the collection")
    void listShouldSkipNestedNames() {
      when(sdk.listSecrets(any(ListSecretsRequest.class)))
          .thenReturn(
              ListSecretsResponse.builder()
                  .secretList(
                      SecretListEntry.builder().name(DB_PASS).createdDate(T0).build(),
                      SecretListEntry.builder()
                          .name("test-project/global/secrets/db-pass/old")
                          .createdDate(T0)
                          .build())
                  .nextToken("next")
                  .build());

      final var page = client.listEntities(SECRETS, null, null, 500);

      assertEquals(1, page.items().size());
      assertEquals("db-pass", page.items().get(0).path().entityId());
      assertEquals("next", page.nextPageToken());
      verify(sdk).listSecrets(argThat((ListSecretsRequest r) -> r.maxResults() == 100));
    }
  }

  @Nested
  @DisplayName("Versions")
  class Versions {

    @Test
    @DisplayName("Sequence ids continue after the highest existing one")
    void addShouldAssignNextSequence() {
      versions(entry("a", T0, "V_1"), entry("b", T0, "V_2", "AWSCURRENT"));
      value("3", "s3cr3t", "V_3", "AWSCURRENT");

      final var version =
          client.addVersion(SECRETS.path("db-pass"), "s3cr3t".getBytes(UTF_8), null);

      final var token = AwsSecretStoreClient.requestToken(SECRETS.path("db-pass"), "3");
      verify(sdk)
          .putSecretValue(
              argThat(
                  (PutSecretValueRequest r) ->
                      r.secretId().equals(DB_PASS)
                          && r.clientRequestToken().equals(token)
                          && r.versionStages().equals(List.of("V_3"))));
      assertEquals("3", version.versionId());
      assertEquals("s3cr3t", new String(version.payload(), UTF_8));
      assertFalse(version.customName());
    }

    @Test
    @DisplayName("A replayed custom-named add returns the stored version")
    void replayShouldReturnExisting() {
      final var path = SECRETS.path("db-pass");
      versions(entry(AwsSecretStoreClient.requestToken(path, "v1"), T0, "V_v1"));
      value("v1", "a", "V_v1");

      final var version = client.addVersion(path, "a".getBytes(UTF_8), "v1");

      assertEquals("v1", version.versionId());
      verify(sdk, never()).putSecretValue(any(PutSecretValueRequest.class));
    }

    @Test
    @DisplayName("A custom name held by another add conflicts")
    void takenNameShouldConflict() {
      versions(entry("someone-else", T0, "V_v1"));

      final var e =
          assertThrows(
              RuntimeException.class,
              () -> client.addVersion(SECRETS.path("db-pass"), new byte[] {1}, "v1"));
      assertEquals(ErrorKind.ALREADY_EXISTS, ExceptionMapper.map(e));
    }

    @Test
    @DisplayName("Numeric custom names are rejected")
    void numericNamesShouldBeRejected() {
      final var e =
          assertThrows(
              RuntimeException.class,
              () -> client.addVersion(SECRETS.path("db-pass"), new byte[] {1}, "42"));
      assertEquals(ErrorKind.INVALID_ARGUMENT, ExceptionMapper.map(e));
      verifyNoInteractions(sdk);
    }

    @Test
    @DisplayName("Disabling moves the DISABLED label onto the version")
    void disableShouldMoveLabel() {
      versions(entry("aws-1", T0, "V_1"));
      value("1", "a", "V_1", "DISABLED_1");

      final var version =
          client.updateVersionState(SECRETS.path("db-pass"), "1", VersionState.DISABLED);

      verify(sdk)
          .updateSecretVersionStage(
              argThat(
                  (UpdateSecretVersionStageRequest r) ->
                      r.versionStage().equals("DISABLED_1")
                          && "aws-1".equals(r.moveToVersionId())
                          && r.removeFromVersionId() == null));
      assertEquals(VersionState.DISABLED, version.state());
    }

    @Test
    @DisplayName("Enabling removes the DISABLED label")
    void enableShouldRemoveLabel() {
      versions(entry("aws-1", T0, "V_1", "DISABLED_1"));
      value("1", "a", "V_1");

      client.updateVersionState(SECRETS.path("db-pass"), "1", VersionState.ENABLED);

      verify(sdk)
          .updateSecretVersionStage(
              argThat(
                  (UpdateSecretVersionStageRequest r) ->
                      "aws-1".equals(r.removeFromVersionId()) && r.moveToVersionId() == null));
    }

    @Test
    @DisplayName("An unchanged state issues no label update")
    void sameStateShouldNotUpdate() {
      versions(entry("aws-1", T0, "V_1"));
      value("1", "a", "V_1");

      client.updateVersionState(SECRETS.path("db-pass"), "1", VersionState.ENABLED);

      verify(sdk, never()).updateSecretVersionStage(any(UpdateSecretVersionStageRequest.class));
    }

    @Test
    @DisplayName("Destroyed versions hide their payload and reject changes")
    void destroyedShouldBeTerminal() {
      versions(entry("aws-1", T0, "V_1", "DESTROYED_1"));
      value("1", "a", "V_1", "DESTROYED_1");

      final var version = client.getVersion(SECRETS.path("db-pass"), "1");
      assertEquals(VersionState.DESTROYED, version.state());
      assertNull(version.payload());

      final var e =
          assertThrows(
              RuntimeException.class,
              () -> client.updateVersionState(SECRETS.path("db-pass"), "1", VersionState.ENABLED));
      assertEquals(ErrorKind.INVALID_ARGUMENT, ExceptionMapper.map(e));
      assertThrows(
          RuntimeException.class, () -> client.destroyVersion(SECRETS.path("db-pass"), "1"));
    }

    @Test
    @DisplayName("Missing versions are NOT_FOUND")
    void missingVersionShouldBeNotFound() {
      versions(entry("aws-1", T0, "V_1"));

      final var e =
          assertThrows(
              RuntimeException.class, () -> client.destroyVersion(SECRETS.path("db-pass"), "9"));
      assertEquals(ErrorKind.NOT_FOUND, ExceptionMapper.map(e));
    }

    @Test
    @DisplayName("Listing sorts by creation time and pages by offset")
    void listShouldSortAndPage() {
      versions(
          entry("c", T0.plusSeconds(20), "V_3"),
          entry("a", T0, "V_1"),
          entry("untracked", T0, "AWSPREVIOUS"),
          entry("b", T0.plusSeconds(10), "V_2", "DISABLED_2"));

      final var first = client.listVersions(SECRETS.path("db-pass"), null, 2);
      assertEquals(List.of("1", "2"), first.items().stream().map(v -> v.versionId()).toList());
      assertEquals(VersionState.DISABLED, first.items().get(1).state());
      assertNull(first.items().get(0).payload());
      assertNotNull(first.nextPageToken());

      final var second = client.listVersions(SECRETS.path("db-pass"), first.nextPageToken(), 2);
      assertEquals(List.of("3"), second.items().stream().map(v -> v.versionId()).toList());
      assertNull(second.nextPageToken());
    }

    @Test
    @DisplayName("Garbage page tokens are INVALID_ARGUMENT")
    void badTokenShouldBeRejected() {
      versions(entry("a", T0, "V_1"));

      final var e =
          assertThrows(
              RuntimeException.class,
              () -> client.listVersions(SECRETS.path("db-pass"), "!!not-a-token", 2));
      assertEquals(ErrorKind.INVALID_ARGUMENT, ExceptionMapper.map(e));
    }
  }

  @Test
  @DisplayName("Closing closes the SDK client once")
  void closeShouldBeIdempotent() {
    client.close();
    client.close();

    assertFalse(client.isAlive());
    verify(sdk, times(1)).close();
  }
}
