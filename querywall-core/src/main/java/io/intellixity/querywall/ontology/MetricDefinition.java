package io.intellixity.querywall.ontology;

import io.intellixity.querywall.plan.Aggregation;

import java.util.Objects;
import java.util.Set;

/**
 * Ontology entry for a metric. Reference data only; never mutated by the firewall.
 *
 * @param maxTimeRangeDays optional per-metric ceiling on the plan's time window, null when unbounded
 */
public record MetricDefinition(String id,
                               String sourceTable,
                               Set<Aggregation> allowedAggregations,
                               Set<String> piiFields,
                               double costWeight,
                               Integer maxTimeRangeDays,
                               boolean enabled) {
  public MetricDefinition {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceTable, "sourceTable");
    allowedAggregations = allowedAggregations == null ? Set.of() : Set.copyOf(allowedAggregations);
    piiFields = piiFields == null ? Set.of() : Set.copyOf(piiFields);
    if (costWeight < 0) throw new IllegalArgumentException("costWeight must be >= 0 for metric " + id);
  }

  public boolean allows(Aggregation aggregation) {
    return allowedAggregations.contains(aggregation);
  }
}
