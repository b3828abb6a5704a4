package io.intellixity.querywall.guardrails;

import io.intellixity.querywall.ontology.MetricDefinition;
import io.intellixity.querywall.ontology.Ontology;
import io.intellixity.querywall.plan.MetricRef;
import io.intellixity.querywall.plan.QueryPlan;

/**
 * Structural cost and time estimates for a plan. Advisory numbers used for budget enforcement,
 * not a prediction of real backend load.
 */
public final class CostModel {
  static final double BASE_COST = 10;
  static final double METRIC_WEIGHT_FACTOR = 5;
  static final double DISTINCT_SURCHARGE = 10;
  static final double JOIN_COST = 15;
  static final double DIMENSION_COST = 3;
  static final double FILTER_COST = 2;
  static final double DAYS_PER_TIME_POINT = 30;
  static final double MAX_TIME_POINTS = 20;

  static final double BASE_TIME_MS = 100;
  static final double METRIC_TIME_MS = 50;
  static final double JOIN_TIME_MS = 300;
  static final double DIMENSION_TIME_MS = 100;
  static final double FILTER_TIME_MS = 20;
  static final double DAY_TIME_MS = 0.5;
  static final double DISTINCT_TIME_MS = 500;

  private final Ontology ontology;

  public CostModel(Ontology ontology) {
    this.ontology = ontology;
  }

  public double estimateCost(QueryPlan plan) {
    double cost = BASE_COST;
    for (MetricRef m : plan.metrics()) {
      double weight = ontology.metric(m.metricId()).map(MetricDefinition::costWeight).orElse(1.0);
      cost += weight * METRIC_WEIGHT_FACTOR;
      if (m.aggregation().isDistinct()) cost += DISTINCT_SURCHARGE;
    }
    cost += plan.joins().size() * JOIN_COST;
    cost += plan.dimensions().size() * DIMENSION_COST;
    cost += plan.filters().size() * FILTER_COST;
    if (plan.timeRange() != null) {
      cost += Math.min(MAX_TIME_POINTS, Math.floor(plan.timeRange().days() / DAYS_PER_TIME_POINT));
    }
    return cost;
  }

  public double estimateTimeMs(QueryPlan plan) {
    double ms = BASE_TIME_MS;
    ms += plan.metrics().size() * METRIC_TIME_MS;
    ms += plan.joins().size() * JOIN_TIME_MS;
    ms += plan.dimensions().size() * DIMENSION_TIME_MS;
    ms += plan.filters().size() * FILTER_TIME_MS;
    if (plan.timeRange() != null) ms += plan.timeRange().days() * DAY_TIME_MS;
    for (MetricRef m : plan.metrics()) {
      if (m.aggregation().isDistinct()) ms += DISTINCT_TIME_MS;
    }
    return ms;
  }
}
