package com.example.resilientsecrets.core.service;

import static org.junit.jupiter.api.Assertions.*;

import com.example.resilientsecrets.core.config.StoreAccessConfig;
import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.store.memory.InMemoryStore;
import com.example.resilientsecrets.core.support.MutableClock;
import com.example.resilientsecrets.core.support.RecordingOperationRecorder;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ParameterServiceTest {

  public record FeatureFlags(boolean checkout, int rollout) {}

  private MutableClock clock;
  private InMemoryStore store;
  private RecordingOperationRecorder recorder;
  private ParameterService parameters;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    store = new InMemoryStore(clock);
    recorder = new RecordingOperationRecorder();
    parameters =
        ParameterService.builder()
            .config(
                StoreAccessConfig.builder()
                    .project("test-project")
                    .poolSize(2)
                    .retryBackoffBaseMillis(0)
                    .build())
            .factory(store.clientFactory())
            .recorder(recorder)
            .clock(clock)
            .build();
  }

  @AfterEach
  void tearDown() {
    parameters.close();
  }

  @Test
  @DisplayName("A null format declares UNFORMATTED")
  void createShouldDefaultFormat() {
    final var entity = parameters.create("motd", null, Map.of());

    assertEquals(ParameterFormat.UNFORMATTED, entity.format());
    assertEquals("parameter.create", recorder.last().operation());
  }

  @Nested
  @DisplayName("Format validation")
  class FormatValidation {

    @BeforeEach
    void createParameters() {
      parameters.create("flags", ParameterFormat.JSON, null);
      parameters.create("routes", ParameterFormat.YAML, null);
    }

    @Test
    @DisplayName("Data that does not parse never reaches addVersion")
    void malformedDataShouldBeRejected() {
      final var entityReads = store.callCount("getEntity");
      final var e =
          assertThrows(
              StoreAccessException.class,
              () -> parameters.addVersion("flags", null, "{\"checkout\": tru"));

      assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
      assertEquals(entityReads + 1, store.callCount("getEntity"));
      assertEquals(0, store.callCount("addVersion"));
      assertEquals("INVALID_ARGUMENT", recorder.last().outcome());
    }

    @Test
    @DisplayName("An explicit format is checked locally before any remote call")
    void explicitFormatShouldBeCheckedFirst() {
      final var entityReads = store.callCount("getEntity");

      assertThrows(
          StoreAccessException.class,
          () -> parameters.addVersion("flags", null, "a: [", ParameterFormat.YAML));

      assertEquals(entityReads, store.callCount("getEntity"));
      assertEquals(0, store.callCount("addVersion"));
    }

    @Test
    @DisplayName("An explicit format must match the declared one")
    void explicitFormatShouldMatchDeclared() {
      final var e =
          assertThrows(
              StoreAccessException.class,
              () -> parameters.addVersion("routes", null, "{}", ParameterFormat.JSON));

      assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
      assertEquals(0, store.callCount("addVersion"));
    }

    @Test
    void validDataShouldBeStored() {
      parameters.addVersion("flags", "v-initial", "{\"checkout\": true}", ParameterFormat.JSON);
      parameters.addVersion("routes", null, "api: /v1\nweb: /\n");

      assertEquals("v-initial", parameters.get("flags").versionId());
      assertEquals("/v1", parameters.getValue("routes").asTree().get("api").asText());
    }
  }

  @Test
  @DisplayName("Structured values are written in the declared format and bound back")
  void structuredValues() {
    parameters.create("flags", ParameterFormat.YAML, null);

    parameters.addVersion("flags", "v1", new FeatureFlags(true, 25));

    final var value = parameters.getValue("flags", "v1");
    assertEquals(ParameterFormat.YAML, value.format());
    assertEquals("v1", value.versionId());
    assertEquals(new FeatureFlags(true, 25), value.as(FeatureFlags.class));
  }

  @Test
  @DisplayName("Unformatted data is stored as-is")
  void unformattedData() {
    parameters.create("motd", ParameterFormat.UNFORMATTED, null);
    parameters.addVersion("motd", null, "not { json");

    final var value = parameters.getValue("motd");
    assertEquals("not { json", value.data());
    assertEquals("not { json", value.asTree().asText());
  }

  @Test
  @DisplayName("Custom names are unique per parameter")
  void customNamesShouldBeUnique() {
    parameters.create("flags", ParameterFormat.JSON, null);
    parameters.addVersion("flags", "v1", "{}");

    final var e =
        assertThrows(StoreAccessException.class, () -> parameters.addVersion("flags", "v1", "[]"));
    assertEquals(ErrorKind.ALREADY_EXISTS, e.kind());
    assertEquals(1, parameters.listVersions("flags").stream().count());
  }

  @Test
  @DisplayName("getAll returns values and per-id failures")
  void getAll() {
    parameters.create("a", ParameterFormat.JSON, null);
    parameters.addVersion("a", null, "{\"n\": 1}");
    parameters.create("empty", ParameterFormat.JSON, null);

    final var result = parameters.getAll(List.of("a", "empty", "missing"));

    assertEquals(1, result.values().get("a").asTree().get("n").asInt());
    assertEquals(
        Map.of("empty", ErrorKind.NOT_FOUND, "missing", ErrorKind.NOT_FOUND), result.failed());
    assertFalse(result.isComplete());
  }

  @Test
  @DisplayName("Disabled versions are readable only through describeVersion")
  void disabledVersions() {
    parameters.create("flags", ParameterFormat.JSON, null);
    parameters.addVersion("flags", "v1", "{}");
    parameters.disableVersion("flags", "v1");

    assertThrows(StoreAccessException.class, () -> parameters.getValue("flags", "v1"));
    assertEquals("{}", parameters.describeVersion("flags", "v1").payloadAsString());

    parameters.enableVersion("flags", "v1");
    assertEquals("{}", parameters.getValue("flags").data());
  }
}
