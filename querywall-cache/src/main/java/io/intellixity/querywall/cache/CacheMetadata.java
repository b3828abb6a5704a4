package io.intellixity.querywall.cache;

import java.time.Instant;

/** Bookkeeping stored next to each cached payload. */
public record CacheMetadata(Instant createdAt,
                            long hitCount,
                            Instant lastHitAt,
                            long ttlSeconds,
                            String queryHash,
                            String templateId) {

  static CacheMetadata created(Instant now, long ttlSeconds, String queryHash, String templateId) {
    return new CacheMetadata(now, 0, now, ttlSeconds, queryHash, templateId);
  }

  CacheMetadata withHit(Instant now) {
    return new CacheMetadata(createdAt, hitCount + 1, now, ttlSeconds, queryHash, templateId);
  }

  /** Seconds left before the entry expires, never negative. */
  long remainingTtlSeconds(Instant now) {
    long age = now.getEpochSecond() - createdAt.getEpochSecond();
    return Math.max(0, ttlSeconds - age);
  }
}
