package io.intellixity.querywall.ontology;

import io.intellixity.querywall.plan.JoinEdge;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only reference data the plan verifier checks against.
 * <p>
 * Owned by the ontology module; the firewall only performs lookups.
 */
public interface Ontology {

  /** Metric definition, empty when the metric is unknown. */
  Optional<MetricDefinition> metric(String metricId);

  /** True when the (undirected) join is on the allow-list. */
  boolean isJoinAllowed(JoinEdge join);

  QueryBudget budget(BudgetTier tier);

  /** Column names (unqualified, lower-case) classified as PII regardless of table. */
  Set<String> piiColumns();

  /** Absolute ceiling on any plan's time window. */
  default int absoluteMaxTimeRangeDays() {
    return 1825;
  }

  default boolean isPiiColumn(String column) {
    return column != null && piiColumns().contains(column.trim().toLowerCase(Locale.ROOT));
  }

  default boolean isJoinGraphAcyclic(Collection<String> tables, Collection<JoinEdge> joins) {
    return JoinGraph.of(tables, joins).isAcyclic();
  }
}
