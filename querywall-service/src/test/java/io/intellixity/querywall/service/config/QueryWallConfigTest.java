package io.intellixity.querywall.service.config;

import io.intellixity.querywall.cache.store.CacheStore;
import io.intellixity.querywall.cache.store.InMemoryCacheStore;
import io.intellixity.querywall.cache.store.RedisCacheStore;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import static org.junit.jupiter.api.Assertions.*;

final class QueryWallConfigTest {

  @Test
  void bindCompany_quotes_the_tenant_literal() {
    assertEquals("SELECT 1 FROM t WHERE company_id = 'acme' LIMIT 1",
        QueryWallConfig.bindCompany("SELECT 1 FROM t WHERE company_id = :companyId LIMIT 1", "acme"));
  }

  @Test
  void bindCompany_escapes_embedded_quotes() {
    assertEquals("company_id = 'o''brien'", QueryWallConfig.bindCompany("company_id = :companyId", "o'brien"));
  }

  @Test
  void bindCompany_passes_null_through() {
    assertNull(QueryWallConfig.bindCompany(null, "acme"));
  }

  @Test
  void cacheStore_is_in_process_without_redis_url() {
    QueryWallProperties props = new QueryWallProperties();
    props.getCache().setMaxMemory(DataSize.ofKilobytes(64));
    try (CacheStore store = new QueryWallConfig().cacheStore(props)) {
      assertInstanceOf(InMemoryCacheStore.class, store);
      store.set("k", "x".repeat(100_000), null);
      assertFalse(store.exists("k"));
    }
  }

  @Test
  void cacheStore_uses_redis_when_url_is_set() {
    QueryWallProperties props = new QueryWallProperties();
    props.getCache().setRedisUrl("redis://127.0.0.1:1");
    try (CacheStore store = new QueryWallConfig().cacheStore(props)) {
      assertInstanceOf(RedisCacheStore.class, store);
    }
  }
}
