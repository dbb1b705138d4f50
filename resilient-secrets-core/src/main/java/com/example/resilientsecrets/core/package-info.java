/**
 * Root package for the resilient-secrets access layer.
 *
 * <p>The layer sits in front of a remote secret or parameter store and gives callers typed results
 * or a {@link com.example.resilientsecrets.core.error.StoreAccessException} carrying an {@link
 * com.example.resilientsecrets.core.error.ErrorKind}, never a vendor exception. Transport failures
 * are retried, listings are driven to completion and store clients are pooled.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.resilientsecrets.core.service.SecretService} and {@link
 *       com.example.resilientsecrets.core.service.ParameterService}: public facades, one timing
 *       record per call.
 *   <li>{@link com.example.resilientsecrets.core.version.VersionManager}: version naming and the
 *       ENABLED / DISABLED / DESTROYED state machine.
 *   <li>{@link com.example.resilientsecrets.core.listing.ListingCoordinator}: lazy paginated
 *       listings and batch operations that report partial failure.
 *   <li>{@link com.example.resilientsecrets.core.pool.ConnectionPool}: fixed-size pool of store
 *       clients with usage statistics.
 *   <li>{@link com.example.resilientsecrets.core.StoreGateway} and {@link
 *       com.example.resilientsecrets.core.Retry}: single remote calls with backoff on transient
 *       failures.
 *   <li>{@link com.example.resilientsecrets.core.error.ExceptionMapper}: total mapping from raw
 *       failures to error kinds.
 *   <li>{@link com.example.resilientsecrets.core.store.aws.AwsSecretStoreClient}: AWS Secrets
 *       Manager backend (supports endpoint/region/credentials overrides).
 *   <li>{@link com.example.resilientsecrets.core.store.memory.InMemoryStore}: in-process backend
 *       for development and tests.
 * </ul>
 */
package com.example.resilientsecrets.core;
