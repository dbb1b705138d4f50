package com.example.resilientsecrets.core.store.aws;

import com.example.resilientsecrets.core.pool.StoreClientFactory;
import com.example.resilientsecrets.core.store.StoreClient;
import java.net.URI;
import java.util.Optional;
import java.util.function.Supplier;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/**
 * Opens {@link AwsSecretStoreClient}s, each with its own {@link SecretsManagerClient}.
 *
 * <p>{@link #fromEnvironment()} reads its configuration from system properties or environment
 * variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 */
public final class AwsStoreClientFactory implements StoreClientFactory {

  private final Supplier<SecretsManagerClient> clients;

  public AwsStoreClientFactory(final Supplier<SecretsManagerClient> clients) {
    if (clients == null) throw new IllegalArgumentException("clients is required");
    this.clients = clients;
  }

  public static AwsStoreClientFactory fromEnvironment() {
    return new AwsStoreClientFactory(AwsStoreClientFactory::buildClient);
  }

  @Override
  public StoreClient create() {
    return new AwsSecretStoreClient(clients.get());
  }

  /**
   * Builds a {@link SecretsManagerClient} honoring region, endpoint and credentials overrides.
   *
   * @return configured client
   */
  static SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder();

    builder.region(setting("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1));

    setting("aws.sm.endpoint", "AWS_SM_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    // Static keys only when both halves are present, else the default provider chain
    setting("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                setting("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.builder().build()));

    return builder.build();
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }
}
