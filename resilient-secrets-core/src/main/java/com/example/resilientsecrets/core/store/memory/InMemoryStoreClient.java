package com.example.resilientsecrets.core.store.memory;

import com.example.resilientsecrets.core.model.Entity;
import com.example.resilientsecrets.core.model.EntityCollection;
import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.example.resilientsecrets.core.model.Version;
import com.example.resilientsecrets.core.model.VersionState;
import com.example.resilientsecrets.core.store.ListFilter;
import com.example.resilientsecrets.core.store.Page;
import com.example.resilientsecrets.core.store.StoreClient;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Session with an {@link InMemoryStore}. A killed or closed client fails every call with an {@link
 * SdkClientException}, as a client with a broken connection would.
 */
public final class InMemoryStoreClient implements StoreClient {

  private final InMemoryStore store;
  private final AtomicBoolean alive = new AtomicBoolean(true);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  InMemoryStoreClient(final InMemoryStore store) {
    this.store = store;
  }

  /** Simulates a dropped connection. */
  public void kill() {
    alive.set(false);
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public Entity createEntity(
      final EntityPath path, final Map<String, String> labels, final ParameterFormat format) {
    ensureUsable();
    return store.createEntity(path, labels, format);
  }

  @Override
  public Entity getEntity(final EntityPath path) {
    ensureUsable();
    return store.getEntity(path);
  }

  @Override
  public Page<Entity> listEntities(
      final EntityCollection collection,
      final ListFilter filter,
      final String pageToken,
      final int pageSize) {
    ensureUsable();
    return store.listEntities(
        collection, filter == null ? ListFilter.ALL : filter, pageToken, pageSize);
  }

  @Override
  public void deleteEntity(final EntityPath path) {
    ensureUsable();
    store.deleteEntity(path);
  }

  @Override
  public Version addVersion(final EntityPath path, final byte[] payload, final String customName) {
    ensureUsable();
    return store.addVersion(path, payload, customName);
  }

  @Override
  public Version getVersion(final EntityPath path, final String versionId) {
    ensureUsable();
    return store.getVersion(path, versionId);
  }

  @Override
  public Version updateVersionState(
      final EntityPath path, final String versionId, final VersionState state) {
    ensureUsable();
    return store.updateVersionState(path, versionId, state);
  }

  @Override
  public Version destroyVersion(final EntityPath path, final String versionId) {
    ensureUsable();
    return store.destroyVersion(path, versionId);
  }

  @Override
  public Page<Version> listVersions(
      final EntityPath path, final String pageToken, final int pageSize) {
    ensureUsable();
    return store.listVersions(path, pageToken, pageSize);
  }

  @Override
  public boolean isAlive() {
    return alive.get() && !closed.get();
  }

  @Override
  public void close() {
    closed.set(true);
  }

  private void ensureUsable() {
    if (closed.get()) throw SdkClientException.create("Store client is closed");
    if (!alive.get()) throw SdkClientException.create("Connection to store lost");
  }
}
