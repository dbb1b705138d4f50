package com.example.resilientsecrets.core;

import static com.example.resilientsecrets.core.Retry.*;
import static org.junit.jupiter.api.Assertions.*;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.PoolTimeoutException;
import com.example.resilientsecrets.core.error.StoreAccessException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RetryTest {

  @AfterEach
  void clearInterruptFlag() {
    if (Thread.currentThread().isInterrupted()) Thread.interrupted();
  }

  private static StoreAccessException unavailable() {
    return new StoreAccessException(ErrorKind.UNAVAILABLE, "connection reset");
  }

  @Nested
  @DisplayName("Basic Retry Behavior - onRetryable")
  class BasicRetryBehavior {

    @Test
    @DisplayName("Should succeed on first attempt")
    void shouldSucceedOnFirstAttempt() {
      assertEquals("ok", onRetryable(() -> "ok", Policy.fixed(3, 0L), "op"));
    }

    @Test
    @DisplayName("Should retry UNAVAILABLE until success")
    void shouldRetryUnavailable() {
      final var attempts = new AtomicInteger(0);

      final var result =
          onRetryable(
              () -> {
                if (attempts.incrementAndGet() < 3) throw unavailable();
                return "recovered";
              },
              Policy.fixed(3, 0L),
              "op");

      assertEquals("recovered", result);
      assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("Should retry POOL_TIMEOUT")
    void shouldRetryPoolTimeout() {
      final var attempts = new AtomicInteger(0);

      final var result =
          onRetryable(
              () -> {
                if (attempts.incrementAndGet() == 1)
                  throw new PoolTimeoutException(Duration.ofMillis(10));
                return "ok";
              },
              Policy.fixed(2, 0L),
              "op");

      assertEquals("ok", result);
      assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Should throw last failure after max attempts")
    void shouldFailAfterMaxAttempts() {
      final var attempts = new AtomicInteger(0);

      final var thrown =
          assertThrows(
              StoreAccessException.class,
              () ->
                  onRetryable(
                      () -> {
                        attempts.incrementAndGet();
                        throw unavailable();
                      },
                      Policy.fixed(4, 0L),
                      "op"));

      assertEquals(ErrorKind.UNAVAILABLE, thrown.kind());
      assertEquals(4, attempts.get());
    }
  }

  @Nested
  @DisplayName("Non-retryable failures")
  class NonRetryable {

    @Test
    @DisplayName("Should not retry NOT_FOUND")
    void shouldNotRetryNotFound() {
      final var attempts = new AtomicInteger(0);

      assertThrows(
          StoreAccessException.class,
          () ->
              onRetryable(
                  () -> {
                    attempts.incrementAndGet();
                    throw StoreAccessException.notFound("missing");
                  },
                  Policy.fixed(5, 0L),
                  "op"));

      assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Should propagate unmapped runtime exceptions untouched")
    void shouldPropagateOtherExceptions() {
      final var attempts = new AtomicInteger(0);

      assertThrows(
          IllegalStateException.class,
          () ->
              onRetryable(
                  () -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("boom");
                  },
                  Policy.fixed(5, 0L),
                  "op"));

      assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Policy.none() makes a single attempt")
    void noneShouldNotRetry() {
      final var attempts = new AtomicInteger(0);

      assertThrows(
          StoreAccessException.class,
          () ->
              onRetryable(
                  () -> {
                    attempts.incrementAndGet();
                    throw unavailable();
                  },
                  Policy.none(),
                  "op"));

      assertEquals(1, attempts.get());
    }
  }

  @Nested
  @DisplayName("Interrupt handling")
  class InterruptHandling {

    @Test
    @DisplayName("Should stop retrying and restore interrupt flag")
    void shouldRestoreInterruptFlag() {
      final var attempts = new AtomicInteger(0);
      Thread.currentThread().interrupt();

      assertThrows(
          StoreAccessException.class,
          () ->
              onRetryable(
                  () -> {
                    attempts.incrementAndGet();
                    throw unavailable();
                  },
                  Policy.fixed(5, 50L),
                  "op"));

      assertEquals(1, attempts.get());
      assertTrue(Thread.currentThread().isInterrupted());
    }
  }

  @Nested
  @DisplayName("Policy")
  class PolicyTests {

    @Test
    void firstAttemptHasNoDelay() {
      assertEquals(0L, Policy.fixed(3, 100L).calculateDelay(1));
    }

    @Test
    void fixedPolicyKeepsDelayConstant() {
      final var policy = Policy.fixed(5, 100L);
      assertEquals(100L, policy.calculateDelay(2));
      assertEquals(100L, policy.calculateDelay(4));
    }

    @Test
    void exponentialPolicyDoublesUpToCap() {
      final var policy = new Policy(10, 100L, 500L, 2.0, false);
      assertEquals(100L, policy.calculateDelay(2));
      assertEquals(200L, policy.calculateDelay(3));
      assertEquals(400L, policy.calculateDelay(4));
      assertEquals(500L, policy.calculateDelay(5));
    }

    @Test
    void jitterAddsAtMostAQuarter() {
      final var policy = Policy.exponential(5, 100L);
      for (int i = 0; i < 50; i++) {
        final var delay = policy.calculateDelay(3);
        assertTrue(delay >= 200L && delay <= 250L, "delay " + delay);
      }
    }

    @Test
    void shouldRejectInvalidPolicies() {
      assertThrows(IllegalArgumentException.class, () -> Policy.fixed(0, 0L));
      assertThrows(IllegalArgumentException.class, () -> Policy.fixed(1, -1L));
      assertThrows(IllegalArgumentException.class, () -> new Policy(2, 100L, 50L, 2.0, false));
      assertThrows(IllegalArgumentException.class, () -> new Policy(2, 100L, 500L, 0.5, false));
    }
  }
}
