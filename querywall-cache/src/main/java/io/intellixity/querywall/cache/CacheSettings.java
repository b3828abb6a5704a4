package io.intellixity.querywall.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of {@link ResultCache}.
 *
 * @param lockTtl lifetime of a stampede lock, bounding how long a crashed holder blocks others
 * @param lockRetryDelay pause between lock polls
 * @param lockMaxRetries polls before a waiter gives up and computes without the lock
 * @param queryStatsTtl lifetime of per-query hit counters
 * @param topQueries size of the top-queries report
 */
public record CacheSettings(Duration defaultTtl,
                            Duration lockTtl,
                            Duration lockRetryDelay,
                            int lockMaxRetries,
                            Duration queryStatsTtl,
                            int topQueries) {
  public static final Duration DEFAULT_TTL = Duration.ofHours(1);
  public static final Duration DEFAULT_LOCK_TTL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_LOCK_RETRY_DELAY = Duration.ofMillis(100);
  public static final int DEFAULT_LOCK_MAX_RETRIES = 50;
  public static final Duration DEFAULT_QUERY_STATS_TTL = Duration.ofDays(7);
  public static final int DEFAULT_TOP_QUERIES = 10;

  public CacheSettings {
    Objects.requireNonNull(defaultTtl, "defaultTtl");
    Objects.requireNonNull(lockTtl, "lockTtl");
    Objects.requireNonNull(lockRetryDelay, "lockRetryDelay");
    Objects.requireNonNull(queryStatsTtl, "queryStatsTtl");
    if (defaultTtl.isNegative() || defaultTtl.isZero()) throw new IllegalArgumentException("defaultTtl must be > 0");
    if (lockMaxRetries < 0) throw new IllegalArgumentException("lockMaxRetries must be >= 0");
    if (topQueries < 0) throw new IllegalArgumentException("topQueries must be >= 0");
  }

  public static CacheSettings defaults() {
    return new CacheSettings(DEFAULT_TTL, DEFAULT_LOCK_TTL, DEFAULT_LOCK_RETRY_DELAY, DEFAULT_LOCK_MAX_RETRIES,
        DEFAULT_QUERY_STATS_TTL, DEFAULT_TOP_QUERIES);
  }
}
