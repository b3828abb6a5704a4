package io.intellixity.querywall.cache;

import io.intellixity.querywall.cache.store.CacheStore;
import io.intellixity.querywall.cache.store.CacheStoreException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Store whose every command fails, as if the cache service were unreachable. */
final class FailingCacheStore implements CacheStore {
  private static CacheStoreException down() {
    return new CacheStoreException("connection refused");
  }

  @Override public Optional<String> get(String key) { throw down(); }
  @Override public void set(String key, String value, Duration ttl) { throw down(); }
  @Override public boolean setIfAbsent(String key, String value, Duration ttl) { throw down(); }
  @Override public boolean setIfPresent(String key, String value, Duration ttl) { throw down(); }
  @Override public boolean exists(String key) { throw down(); }
  @Override public long delete(Collection<String> keys) { throw down(); }
  @Override public List<String> keys(String glob) { throw down(); }
  @Override public long increment(String key, Duration ttlIfCreated) { throw down(); }
  @Override public long memoryUsedBytes() { throw down(); }
  @Override public boolean ping() { return false; }
  @Override public void close() {}
}
