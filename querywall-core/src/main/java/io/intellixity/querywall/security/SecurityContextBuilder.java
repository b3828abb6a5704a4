package io.intellixity.querywall.security;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Derives a {@link SecurityContext} from an already-resolved identity.\n
 *
 * Pure function over a fixed role table; unknown roles get the most restrictive policy.\n
 */
public final class SecurityContextBuilder {
  private static final Set<String> SENSITIVE_TABLES = Set.of("users", "api_keys", "audit_logs", "sessions");

  private static final Set<String> VIEWER_TABLES = Set.of("metrics_company_period");
  private static final Set<String> ANALYST_TABLES = Set.of(
      "metrics_company_period",
      "outcome_scores",
      "benchmarks_cohort_aggregates");
  private static final Set<String> COMPANY_ADMIN_TABLES = Set.of(
      "metrics_company_period",
      "outcome_scores",
      "benchmarks_cohort_aggregates",
      "evidence_snippets");

  private static final Map<Role, Policy> POLICIES;

  static {
    Map<Role, Policy> m = new EnumMap<>(Role.class);
    m.put(Role.VIEWER, new Policy(false, VIEWER_TABLES, SENSITIVE_TABLES, new RateLimits(20, 40)));
    m.put(Role.ANALYST, new Policy(false, ANALYST_TABLES, SENSITIVE_TABLES, new RateLimits(50, 100)));
    m.put(Role.COMPANY_ADMIN, new Policy(false, COMPANY_ADMIN_TABLES, SENSITIVE_TABLES, new RateLimits(100, 200)));
    m.put(Role.SYSTEM_ADMIN, new Policy(true, Set.of(), Set.of(), new RateLimits(1_000, 5_000)));
    POLICIES = Map.copyOf(m);
  }

  private SecurityContextBuilder() {}

  public static SecurityContext build(String tenantId, String role) {
    return build(tenantId, Role.parse(role));
  }

  public static SecurityContext build(String tenantId, Role role) {
    Objects.requireNonNull(tenantId, "tenantId");
    Role r = role == null ? Role.VIEWER : role;
    Policy p = POLICIES.getOrDefault(r, POLICIES.get(Role.VIEWER));
    return new SecurityContext(tenantId.trim(), r, p.allTables, p.allowed, p.denied, p.rateLimits);
  }

  private record Policy(boolean allTables, Set<String> allowed, Set<String> denied, RateLimits rateLimits) {}
}
