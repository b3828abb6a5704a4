package io.intellixity.querywall.ontology;

/** Structural ceilings for a {@link BudgetTier}. */
public record QueryBudget(int maxJoins,
                          int maxGroupByDimensions,
                          int maxRowsReturned,
                          int defaultLimit,
                          double maxCostPoints,
                          long maxExecutionTimeMs) {
  public QueryBudget {
    if (maxJoins < 0) throw new IllegalArgumentException("maxJoins must be >= 0");
    if (maxGroupByDimensions < 0) throw new IllegalArgumentException("maxGroupByDimensions must be >= 0");
    if (maxRowsReturned <= 0) throw new IllegalArgumentException("maxRowsReturned must be > 0");
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be > 0");
    if (maxCostPoints <= 0) throw new IllegalArgumentException("maxCostPoints must be > 0");
    if (maxExecutionTimeMs <= 0) throw new IllegalArgumentException("maxExecutionTimeMs must be > 0");
  }

  public static QueryBudget standard() {
    return new QueryBudget(10, 5, 10_000, 1_000, 100, 5_000);
  }

  public static QueryBudget enterprise() {
    return new QueryBudget(20, 10, 50_000, 1_000, 250, 15_000);
  }
}
