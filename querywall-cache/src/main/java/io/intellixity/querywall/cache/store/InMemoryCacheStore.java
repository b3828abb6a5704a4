package io.intellixity.querywall.cache.store;

import io.intellixity.querywall.cache.internal.Globs;
import io.intellixity.querywall.cache.internal.LruTtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * In-process {@link CacheStore} over a bounded LRU map; least recently used keys are evicted once either
 * the entry ceiling or the memory ceiling is reached. Memory is estimated as UTF-16 key and value bytes
 * plus a fixed per-entry overhead.
 */
public final class InMemoryCacheStore implements CacheStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

  public static final int DEFAULT_MAX_ENTRIES = 100_000;
  public static final long DEFAULT_MAX_BYTES = 256L * 1024 * 1024;
  private static final long ENTRY_OVERHEAD_BYTES = 64;

  private final LruTtlCache<String, String> cache;
  private final AtomicBoolean closed = new AtomicBoolean();

  public InMemoryCacheStore() {
    this(DEFAULT_MAX_ENTRIES);
  }

  public InMemoryCacheStore(int maxEntries) {
    this(maxEntries, DEFAULT_MAX_BYTES);
  }

  public InMemoryCacheStore(int maxEntries, long maxBytes) {
    this(maxEntries, maxBytes, System::currentTimeMillis);
  }

  public InMemoryCacheStore(int maxEntries, LongSupplier nowMillis) {
    this(maxEntries, DEFAULT_MAX_BYTES, nowMillis);
  }

  public InMemoryCacheStore(int maxEntries, long maxBytes, LongSupplier nowMillis) {
    this.cache = new LruTtlCache<>(maxEntries, maxBytes, InMemoryCacheStore::weigh, nowMillis);
    if (log.isDebugEnabled()) {
      log.debug("querywall.cache.store op=open maxEntries={} maxBytes={}", maxEntries, maxBytes);
    }
  }

  @Override
  public Optional<String> get(String key) {
    ensureOpen();
    return Optional.ofNullable(cache.get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    ensureOpen();
    cache.put(key, value, millis(ttl));
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    ensureOpen();
    return cache.putIfAbsent(key, value, millis(ttl));
  }

  @Override
  public boolean setIfPresent(String key, String value, Duration ttl) {
    ensureOpen();
    return cache.replace(key, value, millis(ttl));
  }

  @Override
  public boolean exists(String key) {
    ensureOpen();
    return cache.containsKey(key);
  }

  @Override
  public long delete(Collection<String> keys) {
    ensureOpen();
    long n = 0;
    for (String k : keys) if (cache.remove(k)) n++;
    return n;
  }

  @Override
  public List<String> keys(String glob) {
    ensureOpen();
    Objects.requireNonNull(glob, "glob");
    Pattern p = Globs.compile(glob);
    List<String> out = new ArrayList<>();
    for (String k : cache.keys()) if (p.matcher(k).matches()) out.add(k);
    return out;
  }

  @Override
  public long increment(String key, Duration ttlIfCreated) {
    ensureOpen();
    String v = cache.update(key, prev -> {
      long current;
      try {
        current = prev == null ? 0 : Long.parseLong(prev);
      } catch (NumberFormatException e) {
        throw new CacheStoreException("value at " + key + " is not an integer", e);
      }
      return Long.toString(current + 1);
    }, millis(ttlIfCreated));
    return Long.parseLong(v);
  }

  @Override
  public long memoryUsedBytes() {
    ensureOpen();
    return cache.weight();
  }

  @Override
  public boolean ping() {
    return !closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      cache.clear();
      log.info("querywall.cache.store op=close");
    }
  }

  private void ensureOpen() {
    if (closed.get()) throw new CacheStoreException("cache store is closed");
  }

  private static long weigh(String key, String value) {
    return 2L * (key.length() + value.length()) + ENTRY_OVERHEAD_BYTES;
  }

  private static long millis(Duration ttl) {
    if (ttl == null || ttl.isZero()) return 0;
    if (ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
    return ttl.toMillis();
  }
}
