package io.intellixity.querywall.firewall;

import io.intellixity.querywall.cache.CacheKeyInput;
import io.intellixity.querywall.cache.CacheKeys;
import io.intellixity.querywall.cache.CachedResult;
import io.intellixity.querywall.cache.QueryRateLimiter;
import io.intellixity.querywall.cache.ResultCache;
import io.intellixity.querywall.engine.ExecutionOptions;
import io.intellixity.querywall.engine.ExecutionRequest;
import io.intellixity.querywall.engine.QueryExecutionResult;
import io.intellixity.querywall.engine.exec.QueryExecutor;
import io.intellixity.querywall.guardrails.GuardrailValidator;
import io.intellixity.querywall.guardrails.PlanSafetyVerifier;
import io.intellixity.querywall.plan.PlanFilter;
import io.intellixity.querywall.plan.QueryPlan;
import io.intellixity.querywall.security.SecurityContext;
import io.intellixity.querywall.security.SecurityContextBuilder;
import io.intellixity.querywall.verify.QueryValidationException;
import io.intellixity.querywall.verify.VerificationResult;
import io.intellixity.querywall.verify.ViolationCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The single entry point: context, rate limit, validation, read-through cache, execution.
 * <p>
 * Validation always runs before the cache is consulted, so a cached result is only ever served to a
 * request that passed every check itself. Entries are keyed by tenant, role and the executed statement
 * as well as the question, so two requests share an entry only when they would run the same query
 * under the same policy.
 */
public final class QueryFirewall {
  private static final Logger log = LoggerFactory.getLogger(QueryFirewall.class);

  private final GuardrailValidator guardrails;
  private final PlanSafetyVerifier planVerifier;
  private final ResultCache<QueryExecutionResult> cache;
  private final QueryExecutor executor;
  private final QueryRateLimiter rateLimiter;
  private final FirewallSettings settings;

  /** {@code rateLimiter} may be null to disable per-tenant limits. */
  public QueryFirewall(GuardrailValidator guardrails,
                       PlanSafetyVerifier planVerifier,
                       ResultCache<QueryExecutionResult> cache,
                       QueryExecutor executor,
                       QueryRateLimiter rateLimiter,
                       FirewallSettings settings) {
    this.guardrails = Objects.requireNonNull(guardrails, "guardrails");
    this.planVerifier = Objects.requireNonNull(planVerifier, "planVerifier");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.rateLimiter = rateLimiter;
    this.settings = settings == null ? FirewallSettings.defaults() : settings;
  }

  /**
   * Validates and runs the request, serving from the cache when possible.
   *
   * @throws QueryValidationException with every violation found
   * @throws io.intellixity.querywall.cache.RateLimitExceededException when the tenant is over its hourly limit
   * @throws io.intellixity.querywall.engine.QueryExecutionException on timeout, row cap or backend failure
   */
  public QueryExecutionResult execute(FirewallRequest request) {
    Objects.requireNonNull(request, "request");
    SecurityContext ctx = SecurityContextBuilder.build(request.tenantId(), request.role());
    ExecutionRequest exec = new ExecutionRequest(request.sql(), request.analyticalQuery());
    CacheKeys.requireTenant(ctx.companyId());

    if (rateLimiter != null) rateLimiter.acquire(ctx, request.tier());
    requireValid(request, ctx);

    String question = questionOf(request, exec);
    String key = cacheKey(request, ctx, exec, question);
    ExecutionOptions opts = optionsFor(request);

    CachedResult<QueryExecutionResult> out = cache.withStampedeProtection(key,
        () -> executor.execute(exec, opts), settings.cacheTtl(), request.templateId(), question);

    if (log.isDebugEnabled()) {
      log.debug("querywall.firewall op=execute tenant={} requestId={} key={} cached={} rows={}",
          ctx.companyId(), request.requestId(), key, out.cached(), out.data().metadata().rowCount());
    }
    return out.data().withCached(out.cached(), request.requestId());
  }

  /**
   * Validates and runs the request without reading or writing the cache and without counting it
   * against the tenant's rate limit. Used to pre-compute cache entries.
   */
  public QueryExecutionResult executeUncached(FirewallRequest request) {
    Objects.requireNonNull(request, "request");
    SecurityContext ctx = SecurityContextBuilder.build(request.tenantId(), request.role());
    ExecutionRequest exec = new ExecutionRequest(request.sql(), request.analyticalQuery());
    requireValid(request, ctx);
    return executor.execute(exec, optionsFor(request));
  }

  /** The result cache key the request reads and writes. */
  public String cacheKey(FirewallRequest request) {
    SecurityContext ctx = SecurityContextBuilder.build(request.tenantId(), request.role());
    ExecutionRequest exec = new ExecutionRequest(request.sql(), request.analyticalQuery());
    return cacheKey(request, ctx, exec, questionOf(request, exec));
  }

  private void requireValid(FirewallRequest request, SecurityContext ctx) {
    VerificationResult verdict = validate(request, ctx);
    if (!verdict.valid()) {
      log.warn("querywall.firewall op=reject tenant={} role={} requestId={} severity={} codes={}",
          ctx.companyId(), ctx.role(), request.requestId(), verdict.highestSeverity(), verdict.violationCodes());
      throw new QueryValidationException(verdict);
    }
    if (verdict.requiresRedaction() && log.isInfoEnabled()) {
      log.info("querywall.firewall op=pii tenant={} requestId={} fields={}", ctx.companyId(), request.requestId(),
          verdict.piiFields());
    }
  }

  private static String cacheKey(FirewallRequest request, SecurityContext ctx, ExecutionRequest exec,
                                 String question) {
    return CacheKeys.generate(new CacheKeyInput(question, ctx.companyId(), ctx.role().name(),
        exec.target() + "\n" + exec.statement(), timeRangeOf(request.plan()), filtersOf(request.plan())));
  }

  private ExecutionOptions optionsFor(FirewallRequest request) {
    return new ExecutionOptions(settings.timeoutMs(), settings.maxRows(), request.requestId());
  }

  /** Runs the guardrail on every query text and the plan verifier, merged. No side effects. */
  public VerificationResult validate(FirewallRequest request, SecurityContext ctx) {
    Objects.requireNonNull(ctx, "ctx");
    VerificationResult merged = VerificationResult.passed();

    QueryPlan plan = request.plan();
    if (plan != null) {
      merged = merged.merge(planVerifier.verify(plan, request.tier()));
      if (!planTenantMatches(plan, ctx)) {
        merged = merged.merge(VerificationResult.builder()
            .violation(ViolationCode.PLAN_TENANT, "Plan tenant does not match the caller's tenant")
            .build());
      }
    }
    for (String text : new String[] {request.sql(), request.analyticalQuery()}) {
      if (text != null && !text.isBlank()) {
        merged = merged.merge(guardrails.validate(text, ctx));
      }
    }
    return merged;
  }

  private static boolean planTenantMatches(QueryPlan plan, SecurityContext ctx) {
    // blank plan tenants are reported by the verifier itself
    if (ctx.bypassesRowFilter() || plan.tenantId() == null || plan.tenantId().isBlank()) return true;
    return plan.tenantId().trim().equals(ctx.companyId());
  }

  private static String questionOf(FirewallRequest request, ExecutionRequest exec) {
    String q = request.question();
    return (q == null || q.isBlank()) ? exec.statement() : q;
  }

  private static String timeRangeOf(QueryPlan plan) {
    return (plan == null || plan.timeRange() == null) ? null : plan.timeRange().canonical();
  }

  /** Plan filters as {@code column:operator -> value}; repeated predicates collect into a list. */
  static Map<String, Object> filtersOf(QueryPlan plan) {
    Map<String, List<Object>> grouped = new LinkedHashMap<>();
    if (plan != null) {
      for (PlanFilter f : plan.filters()) {
        String k = f.column().toLowerCase(Locale.ROOT) + ":" + f.operator().name().toLowerCase(Locale.ROOT);
        grouped.computeIfAbsent(k, x -> new ArrayList<>()).add(f.value());
      }
    }
    Map<String, Object> out = new LinkedHashMap<>();
    grouped.forEach((k, values) -> out.put(k, values.size() == 1 ? values.get(0) : values));
    return out;
  }
}
