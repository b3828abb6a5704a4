package io.intellixity.querywall.cache.store;

import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

/** Runs the store contract against a live server named by {@code QUERYWALL_TEST_REDIS_URL}. */
@EnabledIfEnvironmentVariable(named = "QUERYWALL_TEST_REDIS_URL", matches = "redis.*")
final class RedisCacheStoreTest extends CacheStoreContractTest {

  @Override
  protected CacheStore newStore() {
    return new RedisCacheStore(System.getenv("QUERYWALL_TEST_REDIS_URL"));
  }
}
