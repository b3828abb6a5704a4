package io.intellixity.querywall.cache.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryCacheStoreTest extends CacheStoreContractTest {

  @Override
  protected CacheStore newStore() {
    return new InMemoryCacheStore();
  }

  @Test
  void entriesExpireAfterTheirTtl() {
    AtomicLong now = new AtomicLong(1_000);
    InMemoryCacheStore s = new InMemoryCacheStore(100, now::get);

    s.set("a", "1", Duration.ofSeconds(10));
    s.set("b", "2", null);
    now.addAndGet(9_999);
    assertEquals("1", s.get("a").orElseThrow());

    now.addAndGet(1);
    assertTrue(s.get("a").isEmpty());
    assertFalse(s.exists("a"));
    assertEquals("2", s.get("b").orElseThrow());
  }

  @Test
  void setIfAbsent_isExclusiveUntilExpiryOrDelete() {
    AtomicLong now = new AtomicLong(0);
    InMemoryCacheStore s = new InMemoryCacheStore(100, now::get);

    assertTrue(s.setIfAbsent("lock", "x", Duration.ofSeconds(30)));
    assertFalse(s.setIfAbsent("lock", "y", Duration.ofSeconds(30)));
    assertTrue(s.delete("lock"));
    assertTrue(s.setIfAbsent("lock", "z", Duration.ofSeconds(30)));

    now.addAndGet(30_000);
    assertTrue(s.setIfAbsent("lock", "w", Duration.ofSeconds(30)));
  }

  @Test
  void increment_keepsTtlOfExistingCounter() {
    AtomicLong now = new AtomicLong(0);
    InMemoryCacheStore s = new InMemoryCacheStore(100, now::get);

    assertEquals(1, s.increment("c", Duration.ofSeconds(60)));
    now.addAndGet(50_000);
    assertEquals(2, s.increment("c", Duration.ofSeconds(60)));
    now.addAndGet(10_000);
    assertEquals(1, s.increment("c", Duration.ofSeconds(60)));
  }

  @Test
  void increment_rejectsNonIntegerValue() {
    InMemoryCacheStore s = new InMemoryCacheStore();
    s.set("c", "abc", null);
    assertThrows(CacheStoreException.class, () -> s.increment("c", null));
  }

  @Test
  void keys_matchGlobPatterns() {
    InMemoryCacheStore s = new InMemoryCacheStore();
    s.set("nlq:t1:aa", "1", null);
    s.set("nlq:t1:bb", "1", null);
    s.set("nlq:t2:aa", "1", null);
    s.set("nlq:stats:hits", "1", null);

    assertEquals(List.of("nlq:t1:aa", "nlq:t1:bb"), s.keys("nlq:t1:*").stream().sorted().toList());
    assertEquals(2, s.keys("nlq:t?:aa").size());
    assertEquals(1, s.keys("nlq:t[2]:*").size());
    assertEquals(4, s.keys("nlq:*").size());
    assertTrue(s.keys("nlq:t1.*").isEmpty());
  }

  @Test
  void leastRecentlyUsedKeyIsEvictedAtCeiling() {
    InMemoryCacheStore s = new InMemoryCacheStore(2);
    s.set("a", "1", null);
    s.set("b", "2", null);
    s.get("a");
    s.set("c", "3", null);

    assertTrue(s.exists("a"));
    assertFalse(s.exists("b"));
    assertTrue(s.exists("c"));
  }

  @Test
  void largePayloads_areEvictedAtMemoryCeiling() {
    // ~20 KB per entry against a 64 KB budget
    InMemoryCacheStore s = new InMemoryCacheStore(1_000, 64 * 1024);
    String payload = "x".repeat(10_000);
    for (int i = 0; i < 10; i++) s.set("nlq:t1:" + i, payload, null);

    assertTrue(s.memoryUsedBytes() <= 64 * 1024, "used " + s.memoryUsedBytes());
    assertEquals(3, s.keys("nlq:t1:*").size());
    assertTrue(s.exists("nlq:t1:9"));
    assertFalse(s.exists("nlq:t1:0"));
  }

  @Test
  void recentlyReadEntrySurvivesByteEviction() {
    InMemoryCacheStore s = new InMemoryCacheStore(1_000, 64 * 1024);
    String payload = "x".repeat(10_000);
    s.set("a", payload, null);
    s.set("b", payload, null);
    s.set("c", payload, null);
    s.get("a");
    s.set("d", payload, null);

    assertTrue(s.exists("a"));
    assertFalse(s.exists("b"));
  }

  @Test
  void entryLargerThanCeiling_isNotRetained() {
    InMemoryCacheStore s = new InMemoryCacheStore(1_000, 1_024);
    s.set("small", "1", null);
    s.set("huge", "x".repeat(10_000), null);

    assertFalse(s.exists("huge"));
    assertTrue(s.memoryUsedBytes() <= 1_024);
  }

  @Test
  void deletesAndOverwritesReleaseBytes() {
    InMemoryCacheStore s = new InMemoryCacheStore();
    s.set("k", "x".repeat(5_000), null);
    long big = s.memoryUsedBytes();
    s.set("k", "x", null);
    assertTrue(s.memoryUsedBytes() < big);
    s.delete("k");
    assertEquals(0, s.memoryUsedBytes());
  }

  @Test
  void memoryEstimateGrowsWithContent() {
    InMemoryCacheStore s = new InMemoryCacheStore();
    long empty = s.memoryUsedBytes();
    s.set("k", "x".repeat(1_000), null);
    assertTrue(s.memoryUsedBytes() >= empty + 2_000);
  }

  @Test
  void closedStoreRejectsCommands() {
    InMemoryCacheStore s = new InMemoryCacheStore();
    assertTrue(s.ping());
    s.close();
    assertFalse(s.ping());
    assertThrows(CacheStoreException.class, () -> s.get("a"));
  }
}
