package io.intellixity.querywall.cache;

import io.intellixity.querywall.cache.store.InMemoryCacheStore;
import io.intellixity.querywall.ontology.BudgetTier;
import io.intellixity.querywall.security.Role;
import io.intellixity.querywall.security.SecurityContext;
import io.intellixity.querywall.security.SecurityContextBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QueryRateLimiterTest {

  @Test
  void viewerIsCappedAtTwentyPerHourOnStandard() {
    InMemoryCacheStore store = new InMemoryCacheStore();
    QueryRateLimiter limiter = new QueryRateLimiter(store);
    SecurityContext viewer = SecurityContextBuilder.build("t1", Role.VIEWER);

    for (int i = 0; i < 20; i++) assertEquals(19 - i, limiter.acquire(viewer, BudgetTier.STANDARD));
    RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
        () -> limiter.acquire(viewer, BudgetTier.STANDARD));
    assertEquals("t1", e.companyId());
    assertEquals(20, e.limit());
    assertEquals(21, limiter.used("t1"));
    assertTrue(store.exists("nlq:ratelimit:hourly:t1"));
  }

  @Test
  void tenantsAreCountedSeparately() {
    QueryRateLimiter limiter = new QueryRateLimiter(new InMemoryCacheStore());
    limiter.acquire(SecurityContextBuilder.build("t1", Role.ANALYST), BudgetTier.ENTERPRISE);
    assertEquals(1, limiter.used("t1"));
    assertEquals(0, limiter.used("t2"));
  }

  @Test
  void storeFailureFailsOpen() {
    QueryRateLimiter limiter = new QueryRateLimiter(new FailingCacheStore());
    assertEquals(-1, limiter.acquire(SecurityContextBuilder.build("t1", Role.VIEWER), BudgetTier.STANDARD));
    assertEquals(0, limiter.used("t1"));
  }
}
