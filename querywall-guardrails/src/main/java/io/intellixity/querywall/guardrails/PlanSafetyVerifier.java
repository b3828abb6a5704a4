package io.intellixity.querywall.guardrails;

import io.intellixity.querywall.ontology.BudgetTier;
import io.intellixity.querywall.ontology.MetricDefinition;
import io.intellixity.querywall.ontology.Ontology;
import io.intellixity.querywall.ontology.QueryBudget;
import io.intellixity.querywall.plan.Dimension;
import io.intellixity.querywall.plan.JoinEdge;
import io.intellixity.querywall.plan.MetricRef;
import io.intellixity.querywall.plan.PlanFilter;
import io.intellixity.querywall.plan.QueryPlan;
import io.intellixity.querywall.plan.TimeRange;
import io.intellixity.querywall.verify.VerificationResult;
import io.intellixity.querywall.verify.ViolationCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structural verification of a {@link QueryPlan} against the ontology and the tier's budget.\n
 *
 * Collects every violation; PII and time-estimate findings are warnings and never block.\n
 */
public final class PlanSafetyVerifier {
  private static final Logger log = LoggerFactory.getLogger(PlanSafetyVerifier.class);

  private final Ontology ontology;
  private final CostModel costModel;

  public PlanSafetyVerifier(Ontology ontology) {
    this.ontology = Objects.requireNonNull(ontology, "ontology");
    this.costModel = new CostModel(ontology);
  }

  public VerificationResult verify(QueryPlan plan, BudgetTier tier) {
    Objects.requireNonNull(plan, "plan");
    BudgetTier t = tier == null ? BudgetTier.STANDARD : tier;
    QueryBudget budget = ontology.budget(t);

    VerificationResult.Builder out = VerificationResult.builder();
    Set<String> pii = new LinkedHashSet<>();
    Set<String> tables = new LinkedHashSet<>();

    if (plan.tenantId() == null || plan.tenantId().isBlank()) {
      out.violation(ViolationCode.PLAN_TENANT, "Plan must carry a tenant id");
    }

    for (MetricRef m : plan.metrics()) {
      Optional<MetricDefinition> def = ontology.metric(m.metricId());
      if (def.isEmpty() || !def.get().enabled()) {
        out.violation(ViolationCode.PLAN_METRIC_UNKNOWN, "Unknown or disabled metric: " + m.metricId());
        continue;
      }
      MetricDefinition d = def.get();
      tables.add(d.sourceTable().toLowerCase(Locale.ROOT));
      if (!d.allows(m.aggregation())) {
        out.violation(ViolationCode.PLAN_AGG_NOT_ALLOWED,
            "Aggregation " + m.aggregation() + " not allowed for metric " + m.metricId());
      }
      pii.addAll(d.piiFields());
    }

    for (JoinEdge j : plan.joins()) {
      if (!ontology.isJoinAllowed(j)) {
        out.violation(ViolationCode.PLAN_JOIN_NOT_ALLOWED, "Join not allowed: " + j.from() + " -> " + j.to());
      }
    }
    if (!plan.joins().isEmpty() && !ontology.isJoinGraphAcyclic(tables, plan.joins())) {
      out.violation(ViolationCode.PLAN_JOIN_CYCLE, "Join graph contains a cycle");
    }
    if (plan.joins().size() > budget.maxJoins()) {
      out.violation(ViolationCode.PLAN_TOO_MANY_JOINS,
          "Too many joins: " + plan.joins().size() + " (max " + budget.maxJoins() + ")");
    }

    if (plan.dimensions().size() > budget.maxGroupByDimensions()) {
      out.violation(ViolationCode.PLAN_TOO_MANY_DIMENSIONS,
          "Too many dimensions: " + plan.dimensions().size() + " (max " + budget.maxGroupByDimensions() + ")");
    }
    for (Dimension d : plan.dimensions()) {
      if (ontology.isPiiColumn(d.column())) pii.add(d.qualifiedName());
    }

    int limit = plan.limit() != null ? plan.limit() : budget.defaultLimit();
    if (limit <= 0 || limit > budget.maxRowsReturned()) {
      out.violation(ViolationCode.PLAN_LIMIT_EXCEEDED,
          "Limit " + limit + " outside 1.." + budget.maxRowsReturned());
    }

    checkTimeRange(plan, out);

    for (PlanFilter f : plan.filters()) {
      for (InjectionRules.Finding finding : InjectionRules.scanValue(f.value())) {
        out.violation(ViolationCode.PLAN_FILTER_INJECTION,
            "Filter on " + f.column() + " matches " + finding.code() + " pattern");
      }
    }

    double cost = costModel.estimateCost(plan);
    double timeMs = costModel.estimateTimeMs(plan);
    out.estimatedCost(cost).estimatedTimeMs(timeMs);
    if (cost > budget.maxCostPoints()) {
      out.violation(ViolationCode.PLAN_COST_EXCEEDED,
          "Estimated cost " + cost + " exceeds budget of " + budget.maxCostPoints());
    }
    if (timeMs > budget.maxExecutionTimeMs()) {
      out.warning(ViolationCode.TIME_ESTIMATE_EXCEEDED,
          "Estimated time " + timeMs + "ms exceeds " + budget.maxExecutionTimeMs() + "ms");
    }

    if (!pii.isEmpty()) {
      out.piiFields(pii);
      out.warning(ViolationCode.PII_REDACTION_REQUIRED, "PII fields require redaction: " + pii);
    }

    VerificationResult result = out.build();
    if (log.isDebugEnabled()) {
      log.debug("querywall.plan op=verify tenant={} tier={} valid={} cost={} timeMs={} codes={}",
          plan.tenantId(), t, result.valid(), cost, timeMs, result.violationCodes());
    }
    return result;
  }

  private void checkTimeRange(QueryPlan plan, VerificationResult.Builder out) {
    TimeRange range = plan.timeRange();
    if (range == null) return;
    if (!range.isOrdered()) {
      out.violation(ViolationCode.PLAN_TIME_INVALID, "Time range start must be before end");
      return;
    }
    long days = range.days();
    if (days > ontology.absoluteMaxTimeRangeDays()) {
      out.violation(ViolationCode.PLAN_TIME_ABSOLUTE_MAX,
          "Time range of " + days + " days exceeds " + ontology.absoluteMaxTimeRangeDays());
    }
    for (MetricRef m : plan.metrics()) {
      ontology.metric(m.metricId())
          .map(MetricDefinition::maxTimeRangeDays)
          .filter(max -> days > max)
          .ifPresent(max -> out.violation(ViolationCode.PLAN_TIME_METRIC_MAX,
              "Time range of " + days + " days exceeds " + max + " for metric " + m.metricId()));
    }
  }
}
