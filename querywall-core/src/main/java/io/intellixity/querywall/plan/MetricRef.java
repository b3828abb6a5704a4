package io.intellixity.querywall.plan;

import java.util.Objects;

/** A metric requested by a plan together with the aggregation to apply. */
public record MetricRef(String metricId, Aggregation aggregation) {
  public MetricRef {
    Objects.requireNonNull(metricId, "metricId");
    Objects.requireNonNull(aggregation, "aggregation");
  }
}
