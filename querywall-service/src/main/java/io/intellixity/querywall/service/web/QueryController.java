package io.intellixity.querywall.service.web;

import io.intellixity.querywall.engine.QueryExecutionResult;
import io.intellixity.querywall.firewall.FirewallRequest;
import io.intellixity.querywall.firewall.QueryFirewall;
import io.intellixity.querywall.ontology.BudgetTier;
import io.intellixity.querywall.plan.QueryPlan;
import io.intellixity.querywall.security.SecurityContextBuilder;
import io.intellixity.querywall.verify.VerificationResult;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/queries")
public final class QueryController {
  static final String TENANT_HEADER = "X-Tenant-Id";
  static final String ROLE_HEADER = "X-Role";

  private final QueryFirewall firewall;

  public QueryController(QueryFirewall firewall) {
    this.firewall = firewall;
  }

  public record ExecuteQueryRequest(String question,
                                    QueryPlan plan,
                                    String sql,
                                    String analyticalQuery,
                                    String templateId,
                                    String tier) {}

  public record ValidationResponse(boolean valid,
                                   String severity,
                                   List<ErrorResponse.ViolationView> violations,
                                   List<ErrorResponse.ViolationView> warnings,
                                   double estimatedCost,
                                   boolean requiresRedaction,
                                   List<String> piiFields,
                                   String cacheKey) {}

  @PostMapping("/execute")
  public QueryExecutionResult execute(@RequestHeader(TENANT_HEADER) String tenantId,
                                      @RequestHeader(value = ROLE_HEADER, required = false) String role,
                                      @RequestAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE) String requestId,
                                      @RequestBody ExecuteQueryRequest req) {
    return firewall.execute(toFirewallRequest(tenantId, role, requestId, req));
  }

  /** Dry run: reports what {@code execute} would reject, without touching a store, the cache or the rate limit. */
  @PostMapping("/validate")
  public ValidationResponse validate(@RequestHeader(TENANT_HEADER) String tenantId,
                                     @RequestHeader(value = ROLE_HEADER, required = false) String role,
                                     @RequestAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE) String requestId,
                                     @RequestBody ExecuteQueryRequest req) {
    FirewallRequest fr = toFirewallRequest(tenantId, role, requestId, req);
    VerificationResult v = firewall.validate(fr, SecurityContextBuilder.build(fr.tenantId(), fr.role()));
    String severity = v.highestSeverity() == null ? null : v.highestSeverity().name().toLowerCase(Locale.ROOT);
    return new ValidationResponse(v.valid(), severity,
        v.violations().stream().map(ErrorResponse.ViolationView::of).toList(),
        v.warnings().stream().map(ErrorResponse.ViolationView::of).toList(),
        v.estimatedCost(), v.requiresRedaction(), List.copyOf(v.piiFields()),
        v.valid() ? firewall.cacheKey(fr) : null);
  }

  private static FirewallRequest toFirewallRequest(String tenantId, String role, String requestId,
                                                   ExecuteQueryRequest req) {
    if (tenantId == null || tenantId.isBlank()) throw new IllegalArgumentException(TENANT_HEADER + " is required");
    if (req == null) throw new IllegalArgumentException("request body is required");
    return FirewallRequest.builder(tenantId.trim(), role)
        .question(req.question())
        .plan(req.plan())
        .sql(req.sql())
        .analyticalQuery(req.analyticalQuery())
        .templateId(req.templateId())
        .tier(BudgetTier.parse(req.tier()))
        .requestId(requestId)
        .build();
  }
}
