package io.intellixity.querywall.plan;

import java.util.Objects;

/** A single WHERE predicate of a plan; {@code value} may be a scalar or a collection. */
public record PlanFilter(String column, FilterOperator operator, Object value) {
  public PlanFilter {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
  }
}
