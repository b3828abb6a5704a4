package io.intellixity.querywall.security;

import io.intellixity.querywall.ontology.BudgetTier;

/** Queries-per-hour ceilings by tier. */
public record RateLimits(int standardPerHour, int enterprisePerHour) {
  public RateLimits {
    if (standardPerHour <= 0) throw new IllegalArgumentException("standardPerHour must be > 0");
    if (enterprisePerHour <= 0) throw new IllegalArgumentException("enterprisePerHour must be > 0");
  }

  public int perHour(BudgetTier tier) {
    return tier == BudgetTier.ENTERPRISE ? enterprisePerHour : standardPerHour;
  }
}
