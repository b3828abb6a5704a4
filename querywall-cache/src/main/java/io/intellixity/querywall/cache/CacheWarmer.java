package io.intellixity.querywall.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pre-computes common questions per tenant so first reads hit the cache.
 * <p>
 * Entries younger than half their TTL are left alone. Missing entries go through the stampede-protected
 * read-through path; stale ones are recomputed and overwritten.
 */
public final class CacheWarmer<T> {
  private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

  public static final int DEFAULT_CONCURRENCY = 5;

  /** Computes the payload for one question and tenant. */
  @FunctionalInterface
  public interface Loader<T> {
    T load(String companyId, WarmupQuery query);
  }

  /** Resolves the entry key a warmed question is stored under; must match the key live reads compute. */
  @FunctionalInterface
  public interface KeyResolver {
    String keyFor(String companyId, WarmupQuery query);
  }

  private enum Outcome { WARMED, SKIPPED, FAILED }

  private final ResultCache<T> cache;
  private final Loader<T> loader;
  private final KeyResolver keys;
  private final List<WarmupQuery> queries;
  private final int concurrency;
  private final Clock clock;
  private final AtomicBoolean warming = new AtomicBoolean();
  private volatile WarmupReport lastReport = WarmupReport.notRun();

  public CacheWarmer(ResultCache<T> cache, Loader<T> loader, List<WarmupQuery> queries) {
    this(cache, loader, queries, DEFAULT_CONCURRENCY, Clock.systemUTC());
  }

  public CacheWarmer(ResultCache<T> cache, Loader<T> loader, List<WarmupQuery> queries, int concurrency, Clock clock) {
    this(cache, loader, (companyId, q) -> CacheKeys.generate(q.keyFor(companyId)), queries, concurrency, clock);
  }

  public CacheWarmer(ResultCache<T> cache, Loader<T> loader, KeyResolver keys, List<WarmupQuery> queries,
                     int concurrency, Clock clock) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.queries = List.copyOf(queries);
    if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be > 0");
    this.concurrency = concurrency;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public WarmupReport lastReport() {
    return lastReport;
  }

  public WarmupReport warmup(Collection<String> companyIds) {
    return run(companyIds, queries);
  }

  /** Warms only the questions backed by the given templates, e.g. after their data changed. */
  public WarmupReport warmupTemplates(Collection<String> templateIds, Collection<String> companyIds) {
    List<WarmupQuery> subset = queries.stream().filter(q -> templateIds.contains(q.templateId())).toList();
    if (subset.isEmpty()) {
      log.warn("querywall.cache.warmup op=templates templates={} matched=0", templateIds);
      return WarmupReport.notRun();
    }
    return run(companyIds, subset);
  }

  private WarmupReport run(Collection<String> companyIds, List<WarmupQuery> batch) {
    if (!warming.compareAndSet(false, true)) {
      log.warn("querywall.cache.warmup op=run skipped=in_progress");
      return WarmupReport.notRun();
    }
    long started = System.nanoTime();
    AtomicInteger warmed = new AtomicInteger();
    AtomicInteger skipped = new AtomicInteger();
    AtomicInteger failed = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(concurrency, r -> {
      Thread t = new Thread(r, "querywall-cache-warmup");
      t.setDaemon(true);
      return t;
    });
    try {
      log.info("querywall.cache.warmup op=start companies={} questions={}", companyIds.size(), batch.size());
      List<Future<Outcome>> futures = new ArrayList<>();
      for (String companyId : companyIds) {
        for (WarmupQuery q : batch) futures.add(pool.submit(() -> warmOne(companyId, q)));
      }
      for (Future<Outcome> f : futures) {
        Outcome o;
        try {
          o = f.get();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          o = Outcome.FAILED;
        } catch (ExecutionException e) {
          log.error("querywall.cache.warmup op=task err={}", String.valueOf(e.getCause()));
          o = Outcome.FAILED;
        }
        switch (o) {
          case WARMED -> warmed.incrementAndGet();
          case SKIPPED -> skipped.incrementAndGet();
          case FAILED -> failed.incrementAndGet();
        }
      }
    } finally {
      pool.shutdownNow();
      warming.set(false);
    }
    long ms = (System.nanoTime() - started) / 1_000_000;
    WarmupReport report = new WarmupReport(true, companyIds.size(), warmed.get(), skipped.get(), failed.get(), ms);
    lastReport = report;
    log.info("querywall.cache.warmup op=done companies={} warmed={} skipped={} failed={} durationMs={}",
        report.companies(), report.warmed(), report.skipped(), report.failed(), ms);
    return report;
  }

  private Outcome warmOne(String companyId, WarmupQuery q) {
    String key;
    try {
      key = keys.keyFor(companyId, q);
    } catch (RuntimeException e) {
      log.error("querywall.cache.warmup op=key company={} question=\"{}\" err={}", companyId, q.question(), e.toString());
      return Outcome.FAILED;
    }
    try {
      Optional<CacheEntry<T>> existing = cache.peek(key);
      if (existing.isPresent() && isFresh(existing.get().metadata())) {
        if (log.isDebugEnabled()) log.debug("querywall.cache.warmup op=skip key={} reason=fresh", key);
        return Outcome.SKIPPED;
      }
      Duration ttl = q.ttl() != null ? q.ttl() : cache.settings().defaultTtl();
      if (existing.isEmpty()) {
        CachedResult<T> r = cache.withStampedeProtection(key, () -> loader.load(companyId, q), ttl,
            q.templateId(), q.question());
        return r.cached() ? Outcome.SKIPPED : Outcome.WARMED;
      }
      cache.set(key, loader.load(companyId, q), ttl, q.templateId(), q.question());
      return Outcome.WARMED;
    } catch (RuntimeException e) {
      log.error("querywall.cache.warmup op=warm company={} question=\"{}\" err={}", companyId, q.question(), e.toString());
      return Outcome.FAILED;
    }
  }

  private boolean isFresh(CacheMetadata md) {
    long ageMillis = Duration.between(md.createdAt(), Instant.now(clock)).toMillis();
    return ageMillis < md.ttlSeconds() * 1000 / 2;
  }
}
