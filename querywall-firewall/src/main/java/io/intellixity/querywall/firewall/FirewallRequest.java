package io.intellixity.querywall.firewall;

import io.intellixity.querywall.ontology.BudgetTier;
import io.intellixity.querywall.plan.QueryPlan;

import java.util.Objects;

/**
 * One "execute this plan/query for this tenant" call.\n
 *
 * {@code tenantId} and {@code role} arrive already authenticated. At least one of {@code sql} and
 * {@code analyticalQuery} is required; {@code plan} is verified when present.\n
 */
public record FirewallRequest(String tenantId,
                              String role,
                              String question,
                              QueryPlan plan,
                              String sql,
                              String analyticalQuery,
                              String templateId,
                              BudgetTier tier,
                              String requestId) {
  public FirewallRequest {
    Objects.requireNonNull(tenantId, "tenantId");
    if (tenantId.isBlank()) throw new IllegalArgumentException("tenantId is blank");
    tier = tier == null ? BudgetTier.STANDARD : tier;
  }

  public static Builder builder(String tenantId, String role) {
    return new Builder(tenantId, role);
  }

  public static final class Builder {
    private final String tenantId;
    private final String role;
    private String question;
    private QueryPlan plan;
    private String sql;
    private String analyticalQuery;
    private String templateId;
    private BudgetTier tier;
    private String requestId;

    private Builder(String tenantId, String role) {
      this.tenantId = tenantId;
      this.role = role;
    }

    public Builder question(String question) { this.question = question; return this; }
    public Builder plan(QueryPlan plan) { this.plan = plan; return this; }
    public Builder sql(String sql) { this.sql = sql; return this; }
    public Builder analyticalQuery(String q) { this.analyticalQuery = q; return this; }
    public Builder templateId(String templateId) { this.templateId = templateId; return this; }
    public Builder tier(BudgetTier tier) { this.tier = tier; return this; }
    public Builder requestId(String requestId) { this.requestId = requestId; return this; }

    public FirewallRequest build() {
      return new FirewallRequest(tenantId, role, question, plan, sql, analyticalQuery, templateId, tier, requestId);
    }
  }
}
