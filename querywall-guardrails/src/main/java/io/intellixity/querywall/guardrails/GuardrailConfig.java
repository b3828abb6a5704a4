package io.intellixity.querywall.guardrails;

import java.util.Objects;

/**
 * Tunables for {@link GuardrailValidator}.
 *
 * @param tenantColumn column every tenant-scoped statement must filter on
 * @param maxLimit largest accepted {@code LIMIT}
 * @param maxNestingDepth deepest accepted subquery nesting
 * @param maxTimeWindowDays widest accepted span between the first and last ISO date literal
 */
public record GuardrailConfig(String tenantColumn, int maxLimit, int maxNestingDepth, int maxTimeWindowDays) {
  public static final String DEFAULT_TENANT_COLUMN = "company_id";
  public static final int DEFAULT_MAX_LIMIT = 10_000;
  public static final int DEFAULT_MAX_NESTING_DEPTH = 3;
  public static final int DEFAULT_MAX_TIME_WINDOW_DAYS = 730;

  public GuardrailConfig {
    Objects.requireNonNull(tenantColumn, "tenantColumn");
    if (tenantColumn.isBlank()) throw new IllegalArgumentException("tenantColumn is blank");
    if (maxLimit <= 0) throw new IllegalArgumentException("maxLimit must be > 0");
    if (maxNestingDepth < 0) throw new IllegalArgumentException("maxNestingDepth must be >= 0");
    if (maxTimeWindowDays <= 0) throw new IllegalArgumentException("maxTimeWindowDays must be > 0");
  }

  public static GuardrailConfig defaults() {
    return new GuardrailConfig(DEFAULT_TENANT_COLUMN, DEFAULT_MAX_LIMIT, DEFAULT_MAX_NESTING_DEPTH,
        DEFAULT_MAX_TIME_WINDOW_DAYS);
  }

  public GuardrailConfig withMaxLimit(int maxLimit) {
    return new GuardrailConfig(tenantColumn, maxLimit, maxNestingDepth, maxTimeWindowDays);
  }
}
