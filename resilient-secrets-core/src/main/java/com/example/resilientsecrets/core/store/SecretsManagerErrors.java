package com.example.resilientsecrets.core.store;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.secretsmanager.model.InvalidNextTokenException;
import software.amazon.awssdk.services.secretsmanager.model.InvalidParameterException;
import software.amazon.awssdk.services.secretsmanager.model.InvalidRequestException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceExistsException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Builds Secrets Manager service exceptions carrying the error codes the real service sends, for
 * store implementations that detect a failure themselves.
 */
public final class SecretsManagerErrors {

  private SecretsManagerErrors() {}

  public static ResourceNotFoundException notFound(final String message) {
    return ResourceNotFoundException.builder()
        .message(message)
        .awsErrorDetails(details("ResourceNotFoundException", message))
        .statusCode(400)
        .build();
  }

  public static ResourceExistsException exists(final String message) {
    return ResourceExistsException.builder()
        .message(message)
        .awsErrorDetails(details("ResourceExistsException", message))
        .statusCode(400)
        .build();
  }

  public static InvalidParameterException invalidParameter(final String message) {
    return InvalidParameterException.builder()
        .message(message)
        .awsErrorDetails(details("InvalidParameterException", message))
        .statusCode(400)
        .build();
  }

  public static InvalidRequestException invalidRequest(final String message) {
    return InvalidRequestException.builder()
        .message(message)
        .awsErrorDetails(details("InvalidRequestException", message))
        .statusCode(400)
        .build();
  }

  public static InvalidNextTokenException invalidToken(final String token) {
    final var message = "Invalid next token: " + token;
    return InvalidNextTokenException.builder()
        .message(message)
        .awsErrorDetails(details("InvalidNextTokenException", message))
        .statusCode(400)
        .build();
  }

  private static AwsErrorDetails details(final String code, final String message) {
    return AwsErrorDetails.builder()
        .errorCode(code)
        .errorMessage(message)
        .serviceName("SecretsManager")
        .build();
  }
}
