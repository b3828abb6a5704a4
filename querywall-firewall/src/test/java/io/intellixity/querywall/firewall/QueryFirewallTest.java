package io.intellixity.querywall.firewall;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querywall.cache.CacheSettings;
import io.intellixity.querywall.cache.CacheWarmer;
import io.intellixity.querywall.cache.QueryRateLimiter;
import io.intellixity.querywall.cache.RateLimitExceededException;
import io.intellixity.querywall.cache.ResultCache;
import io.intellixity.querywall.cache.WarmupQuery;
import io.intellixity.querywall.cache.WarmupReport;
import io.intellixity.querywall.cache.store.InMemoryCacheStore;
import io.intellixity.querywall.engine.QueryExecutionResult;
import io.intellixity.querywall.engine.TooManyRowsException;
import io.intellixity.querywall.engine.exec.QueryExecutor;
import io.intellixity.querywall.guardrails.GuardrailValidator;
import io.intellixity.querywall.guardrails.PlanSafetyVerifier;
import io.intellixity.querywall.ontology.BudgetTier;
import io.intellixity.querywall.ontology.InMemoryOntology;
import io.intellixity.querywall.plan.Aggregation;
import io.intellixity.querywall.plan.FilterOperator;
import io.intellixity.querywall.plan.QueryPlan;
import io.intellixity.querywall.plan.TimeRange;
import io.intellixity.querywall.verify.QueryValidationException;
import io.intellixity.querywall.verify.Severity;
import io.intellixity.querywall.verify.ViolationCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class QueryFirewallTest {
  private static final String T1 = "t-100";
  private static final String T2 = "t-200";
  private static final String MCP = "metrics_company_period";

  private final InMemoryCacheStore store = new InMemoryCacheStore();
  private final CapturingBackend backend = new CapturingBackend();
  private final QueryExecutor executor = new QueryExecutor(backend, null);
  private final ResultCache<QueryExecutionResult> cache = newCache();
  private final QueryFirewall firewall = new QueryFirewall(
      new GuardrailValidator(),
      new PlanSafetyVerifier(InMemoryOntology.loadDefault()),
      cache,
      executor,
      new QueryRateLimiter(store),
      FirewallSettings.defaults());

  private ResultCache<QueryExecutionResult> newCache() {
    ObjectMapper mapper = ResultCache.defaultMapper();
    return new ResultCache<>(store, mapper, mapper.constructType(QueryExecutionResult.class),
        CacheSettings.defaults(), Runnable::run, Clock.systemUTC());
  }

  @AfterEach
  void tearDown() {
    executor.close();
    cache.close();
  }

  private static String sql(String tenant) {
    return "SELECT SUM(participants_count) AS total FROM " + MCP + " WHERE company_id = '" + tenant + "' "
        + "AND period_start >= '2024-01-01' LIMIT 100";
  }

  private static QueryPlan plan(String tenant) {
    return QueryPlan.builder(tenant)
        .metric("participants_count", Aggregation.SUM)
        .filter("region", FilterOperator.EQ, "EMEA")
        .timeRange(TimeRange.ofDates(LocalDate.parse("2024-01-01"), LocalDate.parse("2024-04-01")))
        .limit(100)
        .build();
  }

  private static FirewallRequest.Builder request(String tenant) {
    return request(tenant, "analyst");
  }

  private static FirewallRequest.Builder request(String tenant, String role) {
    return FirewallRequest.builder(tenant, role)
        .question("How many participants did we have last quarter?")
        .plan(plan(tenant))
        .sql(sql(tenant))
        .requestId("req-1");
  }

  @Test
  void validRequest_executesOnce_thenServesFromCache() {
    QueryExecutionResult first = firewall.execute(request(T1).build());
    QueryExecutionResult second = firewall.execute(request(T1).question("  HOW many participants did we have last quarter? ").build());

    assertFalse(first.metadata().cached());
    assertTrue(second.metadata().cached());
    assertEquals(1, backend.statements.size());
    assertEquals(first.rows(), second.rows());
  }

  @Test
  void crossTenantLiteral_isRejectedBeforeExecution() {
    var ex = assertThrows(QueryValidationException.class,
        () -> firewall.execute(request(T1).sql(sql(T2)).build()));

    assertTrue(ex.result().hasViolation(ViolationCode.TNT_001));
    assertEquals(Severity.CRITICAL, ex.severity());
    assertTrue(backend.statements.isEmpty());
  }

  @Test
  void excessiveLimit_isRejectedWithLimit002() {
    var ex = assertThrows(QueryValidationException.class,
        () -> firewall.execute(request(T1).sql(sql(T1).replace("LIMIT 100", "LIMIT 50000")).build()));

    assertEquals(List.of(ViolationCode.LIMIT_002), ex.result().violationCodes());
    assertTrue(backend.statements.isEmpty());
  }

  @Test
  void planAndGuardrailViolations_areReportedTogether() {
    QueryPlan.Builder heavy = QueryPlan.builder(T1).metric("participants_count", Aggregation.SUM);
    for (int i = 0; i < 15; i++) heavy.join(MCP, "outcome_scores");

    var ex = assertThrows(QueryValidationException.class, () -> firewall.execute(
        request(T1).plan(heavy.build()).sql(sql(T1).replace(" LIMIT 100", "")).build()));

    assertTrue(ex.result().hasViolation(ViolationCode.PLAN_TOO_MANY_JOINS));
    assertTrue(ex.result().hasViolation(ViolationCode.LIMIT_001));
  }

  @Test
  void planForAnotherTenant_isRejected() {
    var ex = assertThrows(QueryValidationException.class,
        () -> firewall.execute(request(T1).plan(plan(T2)).build()));

    assertEquals(List.of(ViolationCode.PLAN_TENANT), ex.result().violationCodes());
  }

  @Test
  void analyticalQuery_isValidatedToo() {
    var ex = assertThrows(QueryValidationException.class, () -> firewall.execute(
        request(T1).analyticalQuery("SELECT count() FROM " + MCP + " WHERE company_id = '" + T2 + "' LIMIT 10")
            .build()));

    assertTrue(ex.result().hasViolation(ViolationCode.TNT_001));
  }

  @Test
  void sameQuestion_differentTenants_neverShareResults() {
    firewall.execute(request(T1).build());
    QueryExecutionResult other = firewall.execute(request(T2).build());

    assertFalse(other.metadata().cached());
    assertEquals(2, backend.statements.size());
  }

  @Test
  void concurrentIdenticalRequests_executeOnce() throws Exception {
    backend.delayMs = 300;
    int callers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<QueryExecutionResult>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return firewall.execute(request(T1).build());
        }));
      }
      start.countDown();

      int uncached = 0;
      for (Future<QueryExecutionResult> f : futures) {
        QueryExecutionResult r = f.get(30, TimeUnit.SECONDS);
        assertEquals(List.of(Map.of("total", "12.5")), r.rows());
        if (!r.metadata().cached()) uncached++;
      }
      assertEquals(1, backend.statements.size());
      assertEquals(1, uncached);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rateLimit_isEnforcedPerTenantAndTier() {
    // viewer, standard tier: 20 per hour
    for (int i = 0; i < 20; i++) {
      firewall.execute(request(T1, "viewer").build());
    }
    var ex = assertThrows(RateLimitExceededException.class,
        () -> firewall.execute(request(T1, "viewer").build()));

    assertEquals(20, ex.limit());
    assertEquals(T1, ex.companyId());
    firewall.execute(request(T2, "viewer").tier(BudgetTier.STANDARD).build());
  }

  @Test
  void executionFailure_isNotCached() {
    backend.rows = new ArrayList<>();
    for (int i = 0; i < 10_001; i++) backend.rows.add(Map.of("total", String.valueOf(i)));

    assertThrows(TooManyRowsException.class, () -> firewall.execute(request(T1).build()));

    backend.rows = List.of(Map.of("total", "1"));
    QueryExecutionResult r = firewall.execute(request(T1).build());
    assertFalse(r.metadata().cached());
    assertEquals(2, backend.statements.size());
  }

  @Test
  void executeUncached_skipsCacheAndRateLimit() {
    for (int i = 0; i < 25; i++) {
      QueryExecutionResult r = firewall.executeUncached(request(T1, "viewer").build());
      assertFalse(r.metadata().cached());
    }

    assertEquals(25, backend.statements.size());
    assertTrue(cache.peek(firewall.cacheKey(request(T1).build())).isEmpty());
  }

  @Test
  void executeUncached_stillValidates() {
    assertThrows(QueryValidationException.class,
        () -> firewall.executeUncached(request(T1).sql(sql(T2)).build()));
    assertTrue(backend.statements.isEmpty());
  }

  @Test
  void warmedEntry_isServedToMatchingRequest() {
    String question = "Total participants";
    var warmer = new CacheWarmer<>(cache,
        (companyId, q) -> firewall.executeUncached(warmRequest(companyId, q)),
        (companyId, q) -> firewall.cacheKey(warmRequest(companyId, q)),
        List.of(WarmupQuery.of(question, "participants", null)), 2, Clock.systemUTC());

    WarmupReport report = warmer.warmup(List.of(T1));
    assertEquals(1, report.warmed());

    QueryExecutionResult r = firewall.execute(
        FirewallRequest.builder(T1, "analyst").question(question).sql(sql(T1)).build());
    assertTrue(r.metadata().cached());
    assertEquals(1, backend.statements.size());
  }

  private static FirewallRequest warmRequest(String companyId, WarmupQuery q) {
    return FirewallRequest.builder(companyId, "analyst").question(q.question()).sql(sql(companyId)).build();
  }

  @Test
  void sameQuestion_differentRoles_doNotShareEntries() {
    String allTenants = "SELECT SUM(participants_count) AS total FROM " + MCP
        + " WHERE period_start >= '2024-01-01' LIMIT 100";
    QueryExecutionResult admin = firewall.execute(request(T1, "system_admin").sql(allTenants).build());
    QueryExecutionResult analyst = firewall.execute(request(T1, "analyst").build());

    assertFalse(admin.metadata().cached());
    assertFalse(analyst.metadata().cached());
    assertEquals(List.of(allTenants, sql(T1)), backend.statements);
    assertNotEquals(firewall.cacheKey(request(T1, "system_admin").build()), firewall.cacheKey(request(T1).build()));
  }

  @Test
  void sameQuestion_sameRole_differentStatement_misses() {
    firewall.execute(request(T1).build());
    QueryExecutionResult narrower = firewall.execute(request(T1).sql(sql(T1).replace("LIMIT 100", "LIMIT 5")).build());

    assertFalse(narrower.metadata().cached());
    assertEquals(2, backend.statements.size());
  }

  @Test
  void statementWhitespace_doesNotSplitEntries() {
    firewall.execute(request(T1).build());
    QueryExecutionResult r = firewall.execute(request(T1).sql("  " + sql(T1).replace(" FROM ", "\n  FROM ")).build());

    assertTrue(r.metadata().cached());
    assertEquals(1, backend.statements.size());
  }

  @Test
  void cachedResult_carriesCurrentRequestId() {
    QueryExecutionResult first = firewall.execute(request(T1).requestId("req-a").build());
    QueryExecutionResult second = firewall.execute(request(T1).requestId("req-b").build());

    assertEquals("req-a", first.metadata().requestId());
    assertTrue(second.metadata().cached());
    assertEquals("req-b", second.metadata().requestId());
  }

  @Test
  void unfilteredScalarSubquery_isRejectedBeforeExecution() {
    String leak = "SELECT (SELECT SUM(participants_count) FROM " + MCP + ") AS all_tenants FROM " + MCP
        + " WHERE company_id = '" + T1 + "' LIMIT 1";
    var ex = assertThrows(QueryValidationException.class, () -> firewall.execute(request(T1).sql(leak).build()));

    assertTrue(ex.result().hasViolation(ViolationCode.TNT_001));
    assertTrue(backend.statements.isEmpty());
  }

  @Test
  void tenantIdsThatAliasKeyNamespaces_areRejected() {
    for (String tenant : List.of("stats", "LOCK", "ratelimit", "t-100:x")) {
      FirewallRequest r = FirewallRequest.builder(tenant, "analyst").question("q").sql(sql(tenant)).build();
      assertThrows(IllegalArgumentException.class, () -> firewall.execute(r), tenant);
    }
    assertTrue(backend.statements.isEmpty());
  }

  @Test
  void filtersOf_groupsRepeatedPredicates() {
    QueryPlan p = QueryPlan.builder(T1)
        .filter("Region", FilterOperator.EQ, "EMEA")
        .filter("region", FilterOperator.EQ, "APAC")
        .filter("score", FilterOperator.GT, 3)
        .build();

    Map<String, Object> f = QueryFirewall.filtersOf(p);

    assertEquals(List.of("EMEA", "APAC"), f.get("region:eq"));
    assertEquals(3, f.get("score:gt"));
  }
}
