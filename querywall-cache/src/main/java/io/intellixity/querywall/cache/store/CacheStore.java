package io.intellixity.querywall.cache.store;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Key-value primitives the result cache, its locks and the rate limiter are built on.
 * <p>
 * Mirrors the small command set of a remote cache service: string values, per-key TTL, glob key scans
 * and atomic counters. Implementations throw {@link CacheStoreException} on transport failures;
 * callers decide whether a failure is soft.
 * <p>
 * A {@code null} or zero TTL means the key does not expire.
 */
public interface CacheStore extends AutoCloseable {

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /** Atomic set-if-absent; true when this call created the key. */
  boolean setIfAbsent(String key, String value, Duration ttl);

  /** Atomic set-if-present; true when an existing key was overwritten. Never creates a key. */
  boolean setIfPresent(String key, String value, Duration ttl);

  boolean exists(String key);

  /** Deletes the keys, returning how many existed. */
  long delete(Collection<String> keys);

  default boolean delete(String key) {
    return delete(List.of(key)) > 0;
  }

  /** Keys matching a glob pattern ({@code *}, {@code ?}, {@code [..]}). */
  List<String> keys(String glob);

  /** Atomic increment; a key created by this call gets {@code ttlIfCreated}, an existing key keeps its TTL. */
  long increment(String key, Duration ttlIfCreated);

  /** Approximate bytes held by the store. */
  long memoryUsedBytes();

  /** True when the store answers. Never throws. */
  boolean ping();

  @Override
  void close();
}
