package io.intellixity.querywall.cache;

import io.intellixity.querywall.cache.store.CacheStore;
import io.intellixity.querywall.ontology.BudgetTier;
import io.intellixity.querywall.security.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-tenant hourly query counter kept in the cache store.
 * <p>
 * The window starts with the first query of the hour and the counter expires with it. Store failures
 * let the query through.
 */
public final class QueryRateLimiter {
  private static final Logger log = LoggerFactory.getLogger(QueryRateLimiter.class);

  public static final Duration WINDOW = Duration.ofHours(1);
  static final String HOURLY_PREFIX = CacheKeys.RATE_LIMIT_PREFIX + ":hourly:";

  private final CacheStore store;

  public QueryRateLimiter(CacheStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Records one query for the tenant.
   *
   * @return queries left in the current window, or -1 when the store could not be consulted
   * @throws RateLimitExceededException when the tenant is over its limit for the tier
   */
  public long acquire(SecurityContext ctx, BudgetTier tier) {
    Objects.requireNonNull(ctx, "ctx");
    long limit = ctx.rateLimits().perHour(tier == null ? BudgetTier.STANDARD : tier);
    long used;
    try {
      used = store.increment(HOURLY_PREFIX + ctx.companyId(), WINDOW);
    } catch (RuntimeException e) {
      log.warn("querywall.ratelimit op=acquire tenant={} degraded=allow err={}", ctx.companyId(), e.toString());
      return -1;
    }
    if (used > limit) {
      log.warn("querywall.ratelimit op=acquire tenant={} used={} limit={} allowed=false", ctx.companyId(), used, limit);
      throw new RateLimitExceededException(ctx.companyId(), limit, WINDOW);
    }
    if (log.isDebugEnabled()) log.debug("querywall.ratelimit op=acquire tenant={} used={} limit={}", ctx.companyId(), used, limit);
    return limit - used;
  }

  /** Queries recorded in the current window; 0 when unknown. */
  public long used(String companyId) {
    try {
      return store.get(HOURLY_PREFIX + companyId).map(Long::parseLong).orElse(0L);
    } catch (RuntimeException e) {
      log.warn("querywall.ratelimit op=used tenant={} err={}", companyId, e.toString());
      return 0;
    }
  }
}
