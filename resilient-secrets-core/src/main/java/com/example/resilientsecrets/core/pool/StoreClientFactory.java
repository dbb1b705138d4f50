package com.example.resilientsecrets.core.pool;

import com.example.resilientsecrets.core.store.StoreClient;

/**
 * Creates new store clients for a {@link ConnectionPool}. Implementations typically open a vendor
 * SDK client configured from the environment.
 */
@FunctionalInterface
public interface StoreClientFactory {
  /**
   * Opens a new client.
   *
   * @return a live client owned by the caller
   */
  StoreClient create();
}
