package io.intellixity.querywall.ontology;

import java.util.Locale;

public enum BudgetTier {
  STANDARD,
  ENTERPRISE;

  /** Null or unknown tiers fall back to {@link #STANDARD}. */
  public static BudgetTier parse(String raw) {
    if (raw == null || raw.isBlank()) return STANDARD;
    try {
      return BudgetTier.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return STANDARD;
    }
  }
}
