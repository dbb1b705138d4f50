package com.example.resilientsecrets.core.error;

import static com.example.resilientsecrets.core.support.StoreFixtures.serviceError;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.secretsmanager.model.DecryptionFailureException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ExceptionMapperTest {

  @Nested
  @DisplayName("Vendor error codes")
  class VendorErrorCodes {

    @ParameterizedTest(name = "{0} -> {2}")
    @CsvSource({
      "ResourceNotFoundException, 400, NOT_FOUND",
      "NoSuchEntity, 400, NOT_FOUND",
      "ResourceExistsException, 400, ALREADY_EXISTS",
      "AccessDeniedException, 400, PERMISSION_DENIED",
      "UnrecognizedClientException, 400, PERMISSION_DENIED",
      "ExpiredTokenException, 400, PERMISSION_DENIED",
      "ThrottlingException, 400, RESOURCE_EXHAUSTED",
      "LimitExceededException, 400, RESOURCE_EXHAUSTED",
      "InvalidParameterException, 400, INVALID_ARGUMENT",
      "InvalidRequestException, 400, INVALID_ARGUMENT",
      "ValidationException, 400, INVALID_ARGUMENT",
      "MalformedPolicyDocumentException, 400, INVALID_ARGUMENT",
      "InternalServiceError, 500, UNAVAILABLE",
      "ServiceUnavailable, 503, UNAVAILABLE"
    })
    void shouldMapByErrorCodeFamily(
        final String code, final int status, final ErrorKind expected) {
      assertEquals(expected, ExceptionMapper.map(serviceError(code, status)));
    }

    @Test
    @DisplayName("Error code wins over HTTP status")
    void errorCodeShouldWinOverStatus() {
      assertEquals(ErrorKind.NOT_FOUND, ExceptionMapper.map(serviceError("NotFound", 500)));
    }

    @Test
    @DisplayName("Novel codes fall back to the HTTP status family")
    void shouldFallBackToStatus() {
      assertEquals(ErrorKind.UNAVAILABLE, ExceptionMapper.map(serviceError("BrandNewFault", 502)));
      assertEquals(
          ErrorKind.PERMISSION_DENIED, ExceptionMapper.map(serviceError("BrandNewFault", 403)));
      assertEquals(
          ErrorKind.RESOURCE_EXHAUSTED, ExceptionMapper.map(serviceError("BrandNewFault", 429)));
      assertEquals(ErrorKind.UNKNOWN, ExceptionMapper.map(serviceError("BrandNewFault", 418)));
    }

    @Test
    @DisplayName("Typed SDK exceptions without details map by class name")
    void shouldUseClassNameWithoutDetails() {
      final var error = ResourceNotFoundException.builder().message("gone").build();
      assertEquals(ErrorKind.NOT_FOUND, ExceptionMapper.map(error));
    }

    @Test
    void decryptionFailureWithoutHintIsUnknown() {
      final var error = DecryptionFailureException.builder().message("kms").statusCode(400).build();
      assertEquals(ErrorKind.UNKNOWN, ExceptionMapper.map(error));
    }

    @Test
    void plainServiceExceptionUsesStatus() {
      final var error = SdkServiceException.builder().statusCode(404).build();
      assertEquals(ErrorKind.NOT_FOUND, ExceptionMapper.map(error));
    }
  }

  @Nested
  @DisplayName("Client-side and generic failures")
  class ClientSideFailures {

    @Test
    void transportFailuresAreUnavailable() {
      assertEquals(ErrorKind.UNAVAILABLE, ExceptionMapper.map(SdkClientException.create("reset")));
      assertEquals(
          ErrorKind.UNAVAILABLE, ExceptionMapper.map(ApiCallTimeoutException.create(1000L)));
      assertEquals(ErrorKind.UNAVAILABLE, ExceptionMapper.map(new IOException("broken pipe")));
      assertEquals(ErrorKind.UNAVAILABLE, ExceptionMapper.map(new TimeoutException()));
    }

    @Test
    void illegalArgumentIsInvalidArgument() {
      assertEquals(
          ErrorKind.INVALID_ARGUMENT, ExceptionMapper.map(new IllegalArgumentException("bad")));
    }

    @Test
    void domainExceptionsKeepTheirKind() {
      assertEquals(
          ErrorKind.POOL_TIMEOUT,
          ExceptionMapper.map(new PoolTimeoutException(Duration.ofSeconds(1))));
      assertEquals(
          ErrorKind.ALREADY_EXISTS, ExceptionMapper.map(StoreAccessException.alreadyExists("x")));
    }

    @Test
    @DisplayName("Wrappers are unwrapped through their cause chain")
    void shouldUnwrapWrappers() {
      final var nested =
          new CompletionException(
              new ExecutionException(serviceError("ResourceNotFoundException", 400)));
      assertEquals(ErrorKind.NOT_FOUND, ExceptionMapper.map(nested));
    }

    @Test
    @DisplayName("Unrecognized and null failures are UNKNOWN")
    void shouldBeTotal() {
      assertEquals(ErrorKind.UNKNOWN, ExceptionMapper.map(new IllegalStateException("odd")));
      assertEquals(ErrorKind.UNKNOWN, ExceptionMapper.map(new OutOfMemoryError()));
      assertEquals(ErrorKind.UNKNOWN, ExceptionMapper.map(null));
      assertEquals(ErrorKind.UNKNOWN, ExceptionMapper.map(new CompletionException(null)));
    }
  }

  @Nested
  @DisplayName("translate")
  class Translate {

    @Test
    void shouldWrapWithKindContextAndCause() {
      final var raw = serviceError("ThrottlingException", 400);
      final var translated = ExceptionMapper.translate(raw, "get secret 'db-pass'");

      assertEquals(ErrorKind.RESOURCE_EXHAUSTED, translated.kind());
      assertSame(raw, translated.getCause());
      assertTrue(translated.getMessage().startsWith("get secret 'db-pass' failed"));
      assertFalse(translated.isRetryable());
    }

    @Test
    void shouldReturnDomainExceptionsUnchanged() {
      final var domain = StoreAccessException.notFound("missing");
      assertSame(domain, ExceptionMapper.translate(new CompletionException(domain), "ctx"));
    }
  }

  @Test
  void onlyTransientKindsAreRetryable() {
    for (final var kind : ErrorKind.values()) {
      final var expected = kind == ErrorKind.UNAVAILABLE || kind == ErrorKind.POOL_TIMEOUT;
      assertEquals(expected, kind.isRetryable(), kind.name());
    }
  }
}
