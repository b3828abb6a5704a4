package io.intellixity.querywall.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.querywall.cache.CacheSettings;
import io.intellixity.querywall.cache.CacheWarmer;
import io.intellixity.querywall.cache.QueryRateLimiter;
import io.intellixity.querywall.cache.ResultCache;
import io.intellixity.querywall.cache.WarmupQuery;
import io.intellixity.querywall.cache.store.CacheStore;
import io.intellixity.querywall.cache.store.InMemoryCacheStore;
import io.intellixity.querywall.cache.store.RedisCacheStore;
import io.intellixity.querywall.engine.Backend;
import io.intellixity.querywall.engine.QueryBackend;
import io.intellixity.querywall.engine.QueryExecutionResult;
import io.intellixity.querywall.engine.exec.QueryExecutor;
import io.intellixity.querywall.firewall.FirewallRequest;
import io.intellixity.querywall.firewall.FirewallSettings;
import io.intellixity.querywall.firewall.QueryFirewall;
import io.intellixity.querywall.guardrails.GuardrailConfig;
import io.intellixity.querywall.guardrails.GuardrailValidator;
import io.intellixity.querywall.guardrails.PlanSafetyVerifier;
import io.intellixity.querywall.jdbc.JdbcHandle;
import io.intellixity.querywall.jdbc.JdbcPools;
import io.intellixity.querywall.jdbc.JdbcQueryBackend;
import io.intellixity.querywall.jdbc.JdbcStoreSettings;
import io.intellixity.querywall.jdbc.clickhouse.ClickHouseDialect;
import io.intellixity.querywall.jdbc.postgres.PostgresDialect;
import io.intellixity.querywall.ontology.InMemoryOntology;
import io.intellixity.querywall.ontology.Ontology;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

@Configuration
@EnableConfigurationProperties(QueryWallProperties.class)
public class QueryWallConfig {

  @Bean
  public Ontology ontology() {
    return InMemoryOntology.loadDefault();
  }

  @Bean
  public GuardrailValidator guardrailValidator(QueryWallProperties props, Ontology ontology) {
    QueryWallProperties.Guardrails g = props.getGuardrails();
    return new GuardrailValidator(new GuardrailConfig(g.getTenantColumn(), g.getMaxLimit(), g.getMaxNestingDepth(),
        g.getMaxTimeWindowDays()), ontology);
  }

  @Bean
  public PlanSafetyVerifier planSafetyVerifier(Ontology ontology) {
    return new PlanSafetyVerifier(ontology);
  }

  // ------------------------------------------------------------------ cache

  @Bean
  public CacheStore cacheStore(QueryWallProperties props) {
    QueryWallProperties.Cache c = props.getCache();
    if (c.getRedisUrl() != null && !c.getRedisUrl().isBlank()) {
      return new RedisCacheStore(c.getRedisUrl());
    }
    return new InMemoryCacheStore(c.getMaxEntries(), c.getMaxMemory().toBytes());
  }

  @Bean
  public ResultCache<QueryExecutionResult> resultCache(CacheStore store, QueryWallProperties props) {
    QueryWallProperties.Cache c = props.getCache();
    CacheSettings settings = new CacheSettings(c.getDefaultTtl(), c.getLockTtl(), c.getLockRetryDelay(),
        c.getLockMaxRetries(), c.getQueryStatsTtl(), c.getTopQueries());
    ObjectMapper mapper = ResultCache.defaultMapper();
    return new ResultCache<>(store, mapper, QueryExecutionResult.class, settings);
  }

  @Bean
  @ConditionalOnProperty(prefix = "querywall.rate-limit", name = "enabled", havingValue = "true", matchIfMissing = true)
  public QueryRateLimiter queryRateLimiter(CacheStore store) {
    return new QueryRateLimiter(store);
  }

  // ------------------------------------------------------------------ stores

  @Bean
  public HikariDataSource rowStoreDataSource(QueryWallProperties props) {
    return JdbcPools.create("querywall-row-store", settingsOf(props.getRowStore()));
  }

  @Bean
  @ConditionalOnExpression("!'${querywall.columnar.jdbc-url:}'.isBlank()")
  public HikariDataSource columnarDataSource(QueryWallProperties props) {
    return JdbcPools.create("querywall-columnar", settingsOf(props.getColumnar()));
  }

  @Bean
  public QueryExecutor queryExecutor(@Qualifier("rowStoreDataSource") HikariDataSource rowStore,
                                     @Qualifier("columnarDataSource") ObjectProvider<HikariDataSource> columnar,
                                     QueryWallProperties props) {
    QueryBackend row = new JdbcQueryBackend(Backend.ROW_STORE,
        new JdbcHandle("row-store", rowStore, props.getRowStore().getSchema()), new PostgresDialect());
    HikariDataSource col = columnar.getIfAvailable();
    QueryBackend colBackend = col == null ? null : new JdbcQueryBackend(Backend.COLUMNAR,
        new JdbcHandle("columnar", col, props.getColumnar().getSchema()), new ClickHouseDialect());
    return new QueryExecutor(row, colBackend);
  }

  @Bean
  public QueryFirewall queryFirewall(GuardrailValidator guardrails,
                                     PlanSafetyVerifier planVerifier,
                                     ResultCache<QueryExecutionResult> cache,
                                     QueryExecutor executor,
                                     ObjectProvider<QueryRateLimiter> rateLimiter,
                                     QueryWallProperties props) {
    QueryWallProperties.Executor e = props.getExecutor();
    FirewallSettings settings = new FirewallSettings(e.getTimeout().toMillis(), e.getMaxRows(),
        props.getCache().getDefaultTtl());
    return new QueryFirewall(guardrails, planVerifier, cache, executor, rateLimiter.getIfAvailable(), settings);
  }

  // ------------------------------------------------------------------ warmer

  @Bean
  public CacheWarmer<QueryExecutionResult> cacheWarmer(ResultCache<QueryExecutionResult> cache,
                                                       QueryFirewall firewall,
                                                       QueryWallProperties props) {
    QueryWallProperties.Warmer w = props.getWarmer();
    Map<String, QueryWallProperties.Query> byTemplate = new HashMap<>();
    List<WarmupQuery> queries = new ArrayList<>();
    for (QueryWallProperties.Query q : w.getQueries()) {
      byTemplate.put(q.getTemplateId(), q);
      queries.add(new WarmupQuery(q.getQuestion(), q.getTemplateId(), null, Map.of(), q.getTtl()));
    }

    BiFunction<String, WarmupQuery, FirewallRequest> requestFor = (companyId, q) -> {
      QueryWallProperties.Query def = byTemplate.get(q.templateId());
      return FirewallRequest.builder(companyId, w.getRole())
          .question(q.question())
          .sql(bindCompany(def.getSql(), companyId))
          .analyticalQuery(bindCompany(def.getAnalyticalQuery(), companyId))
          .templateId(q.templateId())
          .requestId("warmup")
          .build();
    };
    // warmed entries must land under the key live requests for the same template compute
    return new CacheWarmer<>(cache,
        (companyId, q) -> firewall.executeUncached(requestFor.apply(companyId, q)),
        (companyId, q) -> firewall.cacheKey(requestFor.apply(companyId, q)),
        queries, w.getConcurrency(), Clock.systemUTC());
  }

  static String bindCompany(String text, String companyId) {
    if (text == null) return null;
    return text.replace(":companyId", "'" + companyId.replace("'", "''") + "'");
  }

  private static JdbcStoreSettings settingsOf(QueryWallProperties.Store s) {
    return new JdbcStoreSettings(s.getJdbcUrl(), s.getUsername(), s.getPassword(), s.getSchema(),
        s.getMaximumPoolSize(), s.getConnectionTimeout());
  }
}
