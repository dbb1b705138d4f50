package com.example.resilientsecrets.core.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.*;

public class StoreAccessConfigTest {

  private static final List<String> PROPERTIES =
      List.of(
          "store.project",
          "store.location",
          "store.pool.size",
          "store.pool.acquire.timeout.millis",
          "store.pool.validation.interval.seconds",
          "store.retry.max.attempts",
          "store.retry.backoff.base.millis",
          "store.list.page.size",
          "store.cache.ttl.millis");

  @BeforeEach
  @AfterEach
  void clearProperties() {
    PROPERTIES.forEach(System::clearProperty);
  }

  @Test
  @DisplayName("Builder defaults")
  void shouldApplyDefaults() {
    final var config = StoreAccessConfig.builder().build();

    assertEquals("default", config.project());
    assertEquals("global", config.location());
    assertEquals(10, config.poolSize());
    assertEquals(Duration.ofSeconds(5), config.acquireTimeout());
    assertEquals(Duration.ZERO, config.validationInterval());
    assertEquals(3, config.retryMaxAttempts());
    assertEquals(100, config.retryBackoffBaseMillis());
    assertEquals(100, config.pageSize());
    assertEquals(Duration.ZERO, config.cacheTtl());
    assertEquals(Duration.ofSeconds(10), config.lockTimeout());
  }

  @Test
  @DisplayName("Out-of-range values are rejected at build time")
  void shouldValidate() {
    assertThrows(
        IllegalArgumentException.class, () -> StoreAccessConfig.builder().poolSize(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> StoreAccessConfig.builder().project(" ").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> StoreAccessConfig.builder().acquireTimeout(Duration.ZERO).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> StoreAccessConfig.builder().retryMaxAttempts(0).build());
    assertThrows(
        IllegalArgumentException.class, () -> StoreAccessConfig.builder().pageSize(1001).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> StoreAccessConfig.builder().cacheTtl(Duration.ofMillis(-1)).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> StoreAccessConfig.builder().lockTimeout(null).build());
  }

  @Test
  @DisplayName("System properties override defaults")
  void shouldReadSystemProperties() {
    System.setProperty("store.project", "acme");
    System.setProperty("store.pool.size", "4");
    System.setProperty("store.pool.acquire.timeout.millis", "250");
    System.setProperty("store.retry.max.attempts", "1");
    System.setProperty("store.cache.ttl.millis", "30000");

    final var config = StoreAccessConfig.fromEnvironment();

    assertEquals("acme", config.project());
    assertEquals(4, config.poolSize());
    assertEquals(Duration.ofMillis(250), config.acquireTimeout());
    assertEquals(Duration.ofSeconds(30), config.cacheTtl());
    assertEquals(1, config.retryPolicy().maxAttempts());
  }

  @Test
  @DisplayName("Non-numeric values fall back to the default")
  void shouldIgnoreGarbage() {
    System.setProperty("store.pool.size", "lots");

    assertEquals(10, StoreAccessConfig.fromEnvironment().poolSize());
  }

  @Test
  void retryPolicyShouldFollowAttempts() {
    final var policy =
        StoreAccessConfig.builder().retryMaxAttempts(5).retryBackoffBaseMillis(20).build();

    assertEquals(5, policy.retryPolicy().maxAttempts());
  }
}
