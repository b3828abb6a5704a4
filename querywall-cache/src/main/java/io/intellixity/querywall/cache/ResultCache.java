package io.intellixity.querywall.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.querywall.cache.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Content-addressed cache of query results layered on a {@link CacheStore}.
 * <p>
 * Read errors degrade to a miss and lock errors degrade to computing without the lock; tenant isolation
 * and injection checks run before the cache is consulted, so neither can weaken them.
 * <p>
 * Hit bookkeeping (hit count, last hit, per-query counters) is written on a background executor and
 * never blocks or fails a read.
 */
public final class ResultCache<T> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

  private final CacheStore store;
  private final ObjectMapper mapper;
  private final JavaType entryType;
  private final CacheSettings settings;
  private final Executor background;
  private final ExecutorService ownedBackground;
  private final Clock clock;

  public ResultCache(CacheStore store, Class<T> dataType) {
    this(store, defaultMapper(), dataType, CacheSettings.defaults());
  }

  public ResultCache(CacheStore store, ObjectMapper mapper, Class<T> dataType, CacheSettings settings) {
    this(store, mapper, mapper.getTypeFactory().constructType(dataType), settings, newBackgroundExecutor(),
        Clock.systemUTC(), true);
  }

  public ResultCache(CacheStore store, ObjectMapper mapper, JavaType dataType, CacheSettings settings,
                     Executor background, Clock clock) {
    this(store, mapper, dataType, settings, background, clock, false);
  }

  private ResultCache(CacheStore store, ObjectMapper mapper, JavaType dataType, CacheSettings settings,
                      Executor background, Clock clock, boolean ownsBackground) {
    this.store = Objects.requireNonNull(store, "store");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.background = Objects.requireNonNull(background, "background");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.entryType = mapper.getTypeFactory().constructParametricType(CacheEntry.class, Objects.requireNonNull(dataType, "dataType"));
    this.ownedBackground = ownsBackground ? (ExecutorService) background : null;
  }

  /** Jackson mapper used for cache payloads when none is supplied. */
  public static ObjectMapper defaultMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  public CacheSettings settings() {
    return settings;
  }

  // ---------------------------------------------------------------- reads

  /** Entry for {@code key}; counts a hit or a miss and refreshes hit metadata in the background. */
  public Optional<CacheEntry<T>> get(String key) {
    Objects.requireNonNull(key, "key");
    Optional<CacheEntry<T>> found = read(key);
    if (found.isEmpty()) {
      count(CacheKeys.MISSES_KEY);
      if (log.isDebugEnabled()) log.debug("querywall.cache op=get key={} hit=false", key);
      return Optional.empty();
    }

    Instant now = clock.instant();
    CacheEntry<T> e = found.get();
    CacheEntry<T> touched = new CacheEntry<>(e.key(), e.data(), e.metadata().withHit(now));
    refreshHitMetadata(touched, now);
    count(CacheKeys.HITS_KEY);
    if (log.isDebugEnabled()) {
      log.debug("querywall.cache op=get key={} hit=true hitCount={}", key, touched.metadata().hitCount());
    }
    return Optional.of(touched);
  }

  /** Entry for {@code key} without touching statistics or hit metadata. */
  public Optional<CacheEntry<T>> peek(String key) {
    Objects.requireNonNull(key, "key");
    return read(key);
  }

  /** Hits only; keys that miss or fail to decode are absent from the map. */
  public Map<String, CacheEntry<T>> getMultiple(Collection<String> keys) {
    Map<String, CacheEntry<T>> out = new LinkedHashMap<>();
    for (String k : keys) {
      read(k).ifPresent(e -> out.put(k, e));
    }
    if (log.isDebugEnabled()) log.debug("querywall.cache op=get_multiple keys={} hits={}", keys.size(), out.size());
    return out;
  }

  private Optional<CacheEntry<T>> read(String key) {
    String raw;
    try {
      raw = store.get(key).orElse(null);
    } catch (RuntimeException e) {
      log.warn("querywall.cache op=get key={} degraded=miss err={}", key, e.toString());
      return Optional.empty();
    }
    if (raw == null) return Optional.empty();
    try {
      return Optional.of(mapper.readValue(raw, entryType));
    } catch (JsonProcessingException e) {
      log.warn("querywall.cache op=decode key={} degraded=miss err={}", key, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  // ---------------------------------------------------------------- writes

  public void set(String key, T data) {
    set(key, data, settings.defaultTtl(), null, null);
  }

  /**
   * Stores {@code data}, replacing any previous entry and resetting its TTL.
   *
   * @throws io.intellixity.querywall.cache.store.CacheStoreException when the store rejects the write
   */
  public void set(String key, T data, Duration ttl, String templateId, String question) {
    Objects.requireNonNull(key, "key");
    Duration t = ttl == null ? settings.defaultTtl() : ttl;
    String hash = CacheKeys.extractQueryHash(key);
    CacheEntry<T> entry = new CacheEntry<>(key, data, CacheMetadata.created(clock.instant(), t.toSeconds(), hash, templateId));
    store.set(key, encode(entry), t);
    if (question != null && !question.isBlank()) trackQuery(hash, question);
    if (log.isDebugEnabled()) log.debug("querywall.cache op=set key={} ttlSeconds={} templateId={}", key, t.toSeconds(), templateId);
  }

  /** One pending write of {@link #setMultiple}. */
  public record BatchEntry<T>(String key, T data, Duration ttl, String templateId) {}

  public void setMultiple(List<BatchEntry<T>> entries) {
    if (entries.isEmpty()) return;
    Instant now = clock.instant();
    for (BatchEntry<T> b : entries) {
      Duration t = b.ttl() == null ? settings.defaultTtl() : b.ttl();
      CacheMetadata md = CacheMetadata.created(now, t.toSeconds(), CacheKeys.extractQueryHash(b.key()), b.templateId());
      store.set(b.key(), encode(new CacheEntry<>(b.key(), b.data(), md)), t);
    }
    if (log.isDebugEnabled()) log.debug("querywall.cache op=set_multiple entries={}", entries.size());
  }

  // ---------------------------------------------------------------- invalidation

  /** Deletes every key matching the glob. Returns the number deleted, 0 on store errors. */
  public long invalidate(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    try {
      List<String> keys = store.keys(pattern);
      if (keys.isEmpty()) {
        if (log.isDebugEnabled()) log.debug("querywall.cache op=invalidate pattern={} deleted=0", pattern);
        return 0;
      }
      long n = store.delete(keys);
      log.info("querywall.cache op=invalidate pattern={} deleted={}", pattern, n);
      return n;
    } catch (RuntimeException e) {
      log.error("querywall.cache op=invalidate pattern={} err={}", pattern, e.toString());
      return 0;
    }
  }

  public long invalidateByTenant(String tenantId) {
    Objects.requireNonNull(tenantId, "tenantId");
    return deleteEntries(CacheKeys.tenantPattern(tenantId), "tenant=" + tenantId);
  }

  /** Removes entries whose metadata names {@code templateId}. Scans every entry; use sparingly. */
  public long invalidateByTemplate(String templateId) {
    Objects.requireNonNull(templateId, "templateId");
    try {
      List<String> doomed = new ArrayList<>();
      for (String key : store.keys(CacheKeys.allPattern())) {
        if (!CacheKeys.isEntryKey(key)) continue;
        Optional<String> raw = store.get(key);
        if (raw.isEmpty()) continue;
        if (templateId.equals(templateIdOf(key, raw.get()))) doomed.add(key);
      }
      long n = doomed.isEmpty() ? 0 : store.delete(doomed);
      log.info("querywall.cache op=invalidate template={} deleted={}", templateId, n);
      return n;
    } catch (RuntimeException e) {
      log.error("querywall.cache op=invalidate template={} err={}", templateId, e.toString());
      return 0;
    }
  }

  /** Removes every result entry; locks and counters survive. */
  public long invalidateAll() {
    return deleteEntries(CacheKeys.allPattern(), "all");
  }

  private long deleteEntries(String pattern, String scope) {
    try {
      List<String> keys = store.keys(pattern).stream().filter(CacheKeys::isEntryKey).toList();
      long n = keys.isEmpty() ? 0 : store.delete(keys);
      log.info("querywall.cache op=invalidate scope={} deleted={}", scope, n);
      return n;
    } catch (RuntimeException e) {
      log.error("querywall.cache op=invalidate scope={} err={}", scope, e.toString());
      return 0;
    }
  }

  private String templateIdOf(String key, String raw) {
    try {
      JsonNode t = mapper.readTree(raw).path("metadata").path("templateId");
      return t.isTextual() ? t.asText() : null;
    } catch (JsonProcessingException e) {
      if (log.isDebugEnabled()) log.debug("querywall.cache op=invalidate skip={} err={}", key, e.getOriginalMessage());
      return null;
    }
  }

  // ---------------------------------------------------------------- read-through

  public CachedResult<T> withStampedeProtection(String key, Supplier<T> compute) {
    return withStampedeProtection(key, compute, settings.defaultTtl(), null, null);
  }

  /**
   * Read-through with a key-scoped lock so concurrent misses compute once.\n
   *
   * 1. hit: return it\n
   * 2. take the lock (set-if-absent with TTL)\n
   * 3. lock busy: poll until it is released or the poll budget runs out, then read once more\n
   * 4. compute, store, release the lock if this call holds it\n
   *
   * A waiter whose poll budget runs out without a hit computes without ever holding the lock.
   */
  public CachedResult<T> withStampedeProtection(String key, Supplier<T> compute, Duration ttl,
                                                String templateId, String question) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(compute, "compute");

    Optional<CacheEntry<T>> cached = get(key);
    if (cached.isPresent()) return new CachedResult<>(cached.get().data(), true);

    boolean locked = acquireLock(key);
    if (!locked) {
      if (log.isDebugEnabled()) log.debug("querywall.cache op=lock_wait key={}", key);
      waitForLock(key);
      Optional<CacheEntry<T>> afterWait = get(key);
      if (afterWait.isPresent()) return new CachedResult<>(afterWait.get().data(), true);
    }

    try {
      T data = compute.get();
      try {
        set(key, data, ttl, templateId, question);
      } catch (RuntimeException e) {
        log.warn("querywall.cache op=set key={} degraded=uncached err={}", key, e.toString());
      }
      return new CachedResult<>(data, false);
    } finally {
      if (locked) releaseLock(key);
    }
  }

  boolean acquireLock(String key) {
    try {
      boolean ok = store.setIfAbsent(CacheKeys.lockKey(key), UUID.randomUUID().toString(), settings.lockTtl());
      if (ok && log.isDebugEnabled()) log.debug("querywall.cache op=lock_acquired key={}", key);
      return ok;
    } catch (RuntimeException e) {
      log.error("querywall.cache op=lock_acquire key={} err={}", key, e.toString());
      return false;
    }
  }

  void releaseLock(String key) {
    try {
      store.delete(CacheKeys.lockKey(key));
      if (log.isDebugEnabled()) log.debug("querywall.cache op=lock_released key={}", key);
    } catch (RuntimeException e) {
      log.error("querywall.cache op=lock_release key={} err={}", key, e.toString());
    }
  }

  void waitForLock(String key) {
    String lockKey = CacheKeys.lockKey(key);
    int retries = 0;
    while (retries < settings.lockMaxRetries()) {
      boolean held;
      try {
        held = store.exists(lockKey);
      } catch (RuntimeException e) {
        log.warn("querywall.cache op=lock_poll key={} err={}", key, e.toString());
        return;
      }
      if (!held) return;
      try {
        Thread.sleep(settings.lockRetryDelay().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("querywall.cache op=lock_wait key={} interrupted=true retries={}", key, retries);
        return;
      }
      retries++;
    }
    log.warn("querywall.cache op=lock_wait key={} timeout=true retries={}", key, retries);
  }

  // ---------------------------------------------------------------- stats and health

  public CacheStats stats() {
    try {
      long hits = counter(CacheKeys.HITS_KEY);
      long misses = counter(CacheKeys.MISSES_KEY);
      long keys = store.keys(CacheKeys.allPattern()).stream().filter(CacheKeys::isEntryKey).count();
      return new CacheStats(keys, hits, misses, CacheStats.hitRate(hits, misses), store.memoryUsedBytes(),
          settings.defaultTtl().toSeconds(), topQueries(settings.topQueries()));
    } catch (RuntimeException e) {
      log.error("querywall.cache op=stats err={}", e.toString());
      return CacheStats.empty();
    }
  }

  public boolean healthCheck() {
    try {
      return store.ping();
    } catch (RuntimeException e) {
      log.error("querywall.cache op=health err={}", e.toString());
      return false;
    }
  }

  private List<CacheStats.TopQuery> topQueries(int limit) {
    List<CacheStats.TopQuery> all = new ArrayList<>();
    for (String k : store.keys(CacheKeys.QUERY_HITS_PREFIX + "*")) {
      String hash = k.substring(CacheKeys.QUERY_HITS_PREFIX.length());
      long hits = store.get(k).map(Long::parseLong).orElse(0L);
      String question = store.get(CacheKeys.QUERY_TEXT_PREFIX + hash).orElse("");
      all.add(new CacheStats.TopQuery(hash, hits, question));
    }
    all.sort(Comparator.comparingLong(CacheStats.TopQuery::hits).reversed());
    return all.size() > limit ? List.copyOf(all.subList(0, limit)) : all;
  }

  private long counter(String key) {
    return store.get(key).map(Long::parseLong).orElse(0L);
  }

  private void count(String key) {
    try {
      store.increment(key, null);
    } catch (RuntimeException e) {
      log.error("querywall.cache op=count key={} err={}", key, e.toString());
    }
  }

  // ---------------------------------------------------------------- background bookkeeping

  /** Write-if-present: an entry invalidated before the refresh runs stays gone. */
  private void refreshHitMetadata(CacheEntry<T> entry, Instant now) {
    long remaining = entry.metadata().remainingTtlSeconds(now);
    if (remaining <= 0) return;
    runInBackground("hit_refresh", entry.key(),
        () -> store.setIfPresent(entry.key(), encode(entry), Duration.ofSeconds(remaining)));
  }

  private void trackQuery(String hash, String question) {
    runInBackground("track_query", hash, () -> {
      store.increment(CacheKeys.QUERY_HITS_PREFIX + hash, settings.queryStatsTtl());
      store.set(CacheKeys.QUERY_TEXT_PREFIX + hash, question, settings.queryStatsTtl());
    });
  }

  private void runInBackground(String op, String subject, Runnable work) {
    try {
      background.execute(() -> {
        try {
          work.run();
        } catch (RuntimeException e) {
          log.warn("querywall.cache op={} subject={} err={}", op, subject, e.toString());
        }
      });
    } catch (RejectedExecutionException e) {
      log.warn("querywall.cache op={} subject={} rejected=true", op, subject);
    }
  }

  private String encode(CacheEntry<T> entry) {
    try {
      return mapper.writeValueAsString(entry);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cache payload for " + entry.key() + " is not serializable", e);
    }
  }

  private static ExecutorService newBackgroundExecutor() {
    return Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "querywall-cache-bg");
      t.setDaemon(true);
      return t;
    });
  }

  /** Stops the owned background executor. The store is owned by the caller and stays open. */
  @Override
  public void close() {
    if (ownedBackground != null) ownedBackground.shutdown();
  }
}
