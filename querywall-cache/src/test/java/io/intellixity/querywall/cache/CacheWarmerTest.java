package io.intellixity.querywall.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querywall.cache.store.InMemoryCacheStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CacheWarmerTest {

  private final InMemoryCacheStore store = new InMemoryCacheStore();
  private final ObjectMapper mapper = ResultCache.defaultMapper();
  private final List<WarmupQuery> questions = List.of(
      WarmupQuery.of("What is our SROI for last quarter?", "sroi_ratio", "last_quarter"),
      WarmupQuery.of("What is our average VIS score?", "vis_score", "last_quarter"),
      new WarmupQuery("How many volunteers were active last month?", "volunteer_activity", "last_30d", null,
          Duration.ofMinutes(10)));

  private ResultCache<String> cache(Clock clock) {
    return new ResultCache<>(store, mapper, mapper.constructType(String.class), CacheSettings.defaults(),
        Runnable::run, clock);
  }

  @Test
  void warmsEveryQuestionForEveryTenantThenSkipsFreshEntries() {
    ResultCache<String> cache = cache(Clock.systemUTC());
    AtomicInteger loads = new AtomicInteger();
    CacheWarmer<String> warmer = new CacheWarmer<>(cache, (company, q) -> {
      loads.incrementAndGet();
      return company + ":" + q.templateId();
    }, questions);

    WarmupReport first = warmer.warmup(List.of("t1", "t2"));
    assertTrue(first.ran());
    assertEquals(6, first.warmed());
    assertEquals(0, first.failed());
    assertEquals(6, loads.get());

    String key = CacheKeys.generate(new CacheKeyInput("What is our average VIS score?", "t2", "last_quarter", null));
    assertEquals("t2:vis_score", cache.peek(key).orElseThrow().data());

    WarmupReport second = warmer.warmup(List.of("t1", "t2"));
    assertEquals(6, second.skipped());
    assertEquals(6, loads.get());
    assertSame(second, warmer.lastReport());
  }

  @Test
  void staleEntriesAreRecomputed() {
    Instant t0 = Instant.parse("2024-06-01T00:00:00Z");
    AtomicInteger loads = new AtomicInteger();
    CacheWarmer.Loader<String> loader = (company, q) -> "v" + loads.incrementAndGet();

    new CacheWarmer<>(cache(Clock.fixed(t0, ZoneOffset.UTC)), loader, questions).warmup(List.of("t1"));
    Clock later = Clock.fixed(t0.plus(Duration.ofMinutes(31)), ZoneOffset.UTC);
    WarmupReport r = new CacheWarmer<>(cache(later), loader, questions, 2, later).warmup(List.of("t1"));

    // both 1h entries are past half their TTL; the 10 minute one is too
    assertEquals(3, r.warmed());
    assertEquals(6, loads.get());
  }

  @Test
  void loaderFailuresAreCountedNotThrown() {
    CacheWarmer<String> warmer = new CacheWarmer<>(cache(Clock.systemUTC()), (company, q) -> {
      if (q.templateId().equals("vis_score")) throw new IllegalStateException("boom");
      return "ok";
    }, questions);
    WarmupReport r = warmer.warmup(List.of("t1"));
    assertEquals(2, r.warmed());
    assertEquals(1, r.failed());
  }

  @Test
  void templateSubset() {
    AtomicInteger loads = new AtomicInteger();
    CacheWarmer<String> warmer = new CacheWarmer<>(cache(Clock.systemUTC()), (company, q) -> {
      loads.incrementAndGet();
      return "ok";
    }, questions);
    assertEquals(1, warmer.warmupTemplates(List.of("sroi_ratio"), List.of("t1")).warmed());
    assertFalse(warmer.warmupTemplates(List.of("unknown"), List.of("t1")).ran());
    assertEquals(1, loads.get());
  }
}
