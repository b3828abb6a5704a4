package io.intellixity.querywall.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querywall.cache.store.InMemoryCacheStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ResultCacheTest {

  public record Payload(String value, int n) {}

  private static final String KEY_T1 = CacheKeys.generate(new CacheKeyInput("What is our SROI?", "t1", "last_quarter", null));
  private static final String KEY_T1_B = CacheKeys.generate(new CacheKeyInput("VIS trend", "t1", "last_90d", null));
  private static final String KEY_T2 = CacheKeys.generate(new CacheKeyInput("What is our SROI?", "t2", "last_quarter", null));

  private final InMemoryCacheStore store = new InMemoryCacheStore();

  private static CacheSettings settings(Duration retryDelay, int retries) {
    return new CacheSettings(Duration.ofHours(1), Duration.ofSeconds(30), retryDelay, retries, Duration.ofDays(7), 10);
  }

  private ResultCache<Payload> cache(CacheSettings settings) {
    ObjectMapper mapper = ResultCache.defaultMapper();
    // synchronous background work keeps hit bookkeeping observable
    return new ResultCache<>(store, mapper, mapper.constructType(Payload.class), settings, Runnable::run, Clock.systemUTC());
  }

  private ResultCache<Payload> cache() {
    return cache(CacheSettings.defaults());
  }

  @Test
  void missThenHit_roundTripsPayloadAndMetadata() {
    ResultCache<Payload> c = cache();
    assertTrue(c.get(KEY_T1).isEmpty());

    c.set(KEY_T1, new Payload("sroi", 3), Duration.ofMinutes(5), "sroi_ratio", "What is our SROI?");
    CacheEntry<Payload> e = c.get(KEY_T1).orElseThrow();
    assertEquals(new Payload("sroi", 3), e.data());
    assertEquals(1, e.metadata().hitCount());
    assertEquals(300, e.metadata().ttlSeconds());
    assertEquals("sroi_ratio", e.metadata().templateId());
    assertEquals(CacheKeys.extractQueryHash(KEY_T1), e.metadata().queryHash());

    assertEquals(2, c.get(KEY_T1).orElseThrow().metadata().hitCount());
    assertEquals(2, c.peek(KEY_T1).orElseThrow().metadata().hitCount());
  }

  @Test
  void hitRefreshQueuedBeforeInvalidation_doesNotResurrectEntry() {
    List<Runnable> queued = new ArrayList<>();
    ObjectMapper mapper = ResultCache.defaultMapper();
    ResultCache<Payload> c = new ResultCache<>(store, mapper, mapper.constructType(Payload.class),
        CacheSettings.defaults(), queued::add, Clock.systemUTC());

    c.set(KEY_T1, new Payload("sroi", 3), Duration.ofMinutes(5), "sroi_ratio", "What is our SROI?");
    assertTrue(c.get(KEY_T1).isPresent());
    assertFalse(queued.isEmpty());

    assertEquals(1, c.invalidateByTenant("t1"));
    queued.forEach(Runnable::run);

    assertFalse(store.exists(KEY_T1));
    assertTrue(c.peek(KEY_T1).isEmpty());
  }

  @Test
  void hitRefresh_stillBumpsLiveEntries() {
    List<Runnable> queued = new ArrayList<>();
    ObjectMapper mapper = ResultCache.defaultMapper();
    ResultCache<Payload> c = new ResultCache<>(store, mapper, mapper.constructType(Payload.class),
        CacheSettings.defaults(), queued::add, Clock.systemUTC());

    c.set(KEY_T1, new Payload("sroi", 3), Duration.ofMinutes(5), "sroi_ratio", "What is our SROI?");
    c.get(KEY_T1);
    queued.forEach(Runnable::run);

    assertEquals(1, c.peek(KEY_T1).orElseThrow().metadata().hitCount());
  }

  @Test
  void stats_reportHitRateKeysAndTopQueries() {
    ResultCache<Payload> c = cache();
    c.set(KEY_T1, new Payload("a", 1), null, null, "What is our SROI?");
    c.set(KEY_T1, new Payload("a", 1), null, null, "What is our SROI?");
    c.set(KEY_T1_B, new Payload("b", 1), null, null, "VIS trend");

    c.get(KEY_T1);
    c.get(KEY_T2);
    c.get(KEY_T2);

    CacheStats s = c.stats();
    assertEquals(1, s.totalHits());
    assertEquals(2, s.totalMisses());
    assertEquals(33.33, s.hitRate(), 1e-9);
    assertEquals(2, s.totalKeys());
    assertTrue(s.memoryUsedBytes() > 0);
    assertEquals(3600, s.avgTtlSeconds());
    assertEquals(2, s.topQueries().size());
    assertEquals(new CacheStats.TopQuery(CacheKeys.extractQueryHash(KEY_T1), 2, "What is our SROI?"), s.topQueries().get(0));
  }

  @Test
  void invalidateByTenant_leavesOtherTenantsLocksAndCounters() {
    ResultCache<Payload> c = cache();
    c.set(KEY_T1, new Payload("a", 1));
    c.set(KEY_T1_B, new Payload("b", 1));
    c.set(KEY_T2, new Payload("c", 1));
    c.get(KEY_T1);
    store.set(CacheKeys.lockKey(KEY_T2), "x", Duration.ofSeconds(30));

    assertEquals(2, c.invalidateByTenant("t1"));
    assertTrue(c.peek(KEY_T1).isEmpty());
    assertTrue(c.peek(KEY_T2).isPresent());
    assertTrue(store.exists(CacheKeys.lockKey(KEY_T2)));
    assertEquals(1, c.stats().totalHits());
  }

  @Test
  void invalidateByTemplate_inspectsMetadata() {
    ResultCache<Payload> c = cache();
    c.set(KEY_T1, new Payload("a", 1), null, "sroi_ratio", null);
    c.set(KEY_T1_B, new Payload("b", 1), null, "vis_score", null);
    c.set(KEY_T2, new Payload("c", 1), null, "sroi_ratio", null);

    assertEquals(2, c.invalidateByTemplate("sroi_ratio"));
    assertTrue(c.peek(KEY_T1_B).isPresent());
    assertEquals(0, c.invalidateByTemplate("missing"));
  }

  @Test
  void invalidatePatternAndAll() {
    ResultCache<Payload> c = cache();
    c.set(KEY_T1, new Payload("a", 1));
    c.set(KEY_T2, new Payload("b", 1));
    assertEquals(1, c.invalidate("nlq:t2:*"));
    assertEquals(1, c.invalidateAll());
    assertEquals(0, c.stats().totalKeys());
  }

  @Test
  void batchOperations() {
    ResultCache<Payload> c = cache();
    c.setMultiple(List.of(
        new ResultCache.BatchEntry<>(KEY_T1, new Payload("a", 1), null, "t"),
        new ResultCache.BatchEntry<>(KEY_T2, new Payload("b", 2), Duration.ofMinutes(1), null)));

    Map<String, CacheEntry<Payload>> got = c.getMultiple(List.of(KEY_T1, KEY_T1_B, KEY_T2));
    assertEquals(List.of(KEY_T1, KEY_T2), new ArrayList<>(got.keySet()));
    assertEquals(60, got.get(KEY_T2).metadata().ttlSeconds());
  }

  @Test
  void concurrentMisses_computeOnce() throws Exception {
    ResultCache<Payload> c = cache(settings(Duration.ofMillis(10), 500));
    AtomicInteger computes = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    int n = 8;
    ExecutorService pool = Executors.newFixedThreadPool(n);
    try {
      List<Future<CachedResult<Payload>>> futures = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        Callable<CachedResult<Payload>> call = () -> {
          start.await();
          return c.withStampedeProtection(KEY_T1, () -> {
            computes.incrementAndGet();
            sleep(200);
            return new Payload("fresh", 1);
          });
        };
        futures.add(pool.submit(call));
      }
      start.countDown();

      int uncached = 0;
      for (Future<CachedResult<Payload>> f : futures) {
        CachedResult<Payload> r = f.get(10, TimeUnit.SECONDS);
        assertEquals(new Payload("fresh", 1), r.data());
        if (!r.cached()) uncached++;
      }
      assertEquals(1, computes.get());
      assertEquals(1, uncached);
      assertFalse(store.exists(CacheKeys.lockKey(KEY_T1)));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void waiterThatTimesOut_computesWithoutTakingOrReleasingTheLock() {
    ResultCache<Payload> c = cache(settings(Duration.ofMillis(1), 3));
    store.set(CacheKeys.lockKey(KEY_T1), "someone-else", Duration.ofSeconds(30));

    CachedResult<Payload> r = c.withStampedeProtection(KEY_T1, () -> new Payload("x", 1));
    assertFalse(r.cached());
    assertEquals("someone-else", store.get(CacheKeys.lockKey(KEY_T1)).orElseThrow());
    assertTrue(c.peek(KEY_T1).isPresent());
  }

  @Test
  void lockIsReleasedWhenComputeFails() {
    ResultCache<Payload> c = cache();
    assertThrows(IllegalStateException.class, () -> c.withStampedeProtection(KEY_T1, () -> {
      throw new IllegalStateException("backend down");
    }));
    assertFalse(store.exists(CacheKeys.lockKey(KEY_T1)));
    assertTrue(c.peek(KEY_T1).isEmpty());
  }

  @Test
  void unreachableStore_degradesToMissAndStillComputes() {
    ObjectMapper mapper = ResultCache.defaultMapper();
    ResultCache<Payload> c = new ResultCache<>(new FailingCacheStore(), mapper, mapper.constructType(Payload.class),
        settings(Duration.ofMillis(1), 2), Runnable::run, Clock.systemUTC());

    assertTrue(c.get(KEY_T1).isEmpty());
    CachedResult<Payload> r = c.withStampedeProtection(KEY_T1, () -> new Payload("x", 1));
    assertEquals(new Payload("x", 1), r.data());
    assertFalse(r.cached());
    assertEquals(0, c.invalidateByTenant("t1"));
    assertEquals(0, c.stats().totalKeys());
    assertFalse(c.healthCheck());
  }

  @Test
  void corruptEntry_isAMiss() {
    ResultCache<Payload> c = cache();
    store.set(KEY_T1, "{not json", null);
    assertTrue(c.get(KEY_T1).isEmpty());
  }

  private static void sleep(long ms) {
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
