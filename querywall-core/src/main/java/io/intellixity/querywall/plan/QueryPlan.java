package io.intellixity.querywall.plan;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural, pre-text description of a request, as produced by the NLQ translator.\n
 *
 * Immutable once built; the verifier never mutates it.\n
 */
@JsonDeserialize(using = QueryPlanJsonDeserializer.class)
public record QueryPlan(String tenantId,
                        List<MetricRef> metrics,
                        List<JoinEdge> joins,
                        List<Dimension> dimensions,
                        List<PlanFilter> filters,
                        TimeRange timeRange,
                        Integer limit) {

  public QueryPlan {
    metrics = metrics == null ? List.of() : List.copyOf(metrics);
    joins = joins == null ? List.of() : List.copyOf(joins);
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    filters = filters == null ? List.of() : List.copyOf(filters);
  }

  public static Builder builder(String tenantId) {
    return new Builder(tenantId);
  }

  public static final class Builder {
    private final String tenantId;
    private final List<MetricRef> metrics = new ArrayList<>();
    private final List<JoinEdge> joins = new ArrayList<>();
    private final List<Dimension> dimensions = new ArrayList<>();
    private final List<PlanFilter> filters = new ArrayList<>();
    private TimeRange timeRange;
    private Integer limit;

    private Builder(String tenantId) {
      this.tenantId = tenantId;
    }

    public Builder metric(String metricId, Aggregation aggregation) {
      metrics.add(new MetricRef(metricId, aggregation));
      return this;
    }

    public Builder join(String from, String to) {
      joins.add(new JoinEdge(from, to));
      return this;
    }

    public Builder dimension(String table, String column) {
      dimensions.add(new Dimension(table, column));
      return this;
    }

    public Builder filter(String column, FilterOperator operator, Object value) {
      filters.add(new PlanFilter(column, operator, value));
      return this;
    }

    public Builder timeRange(TimeRange timeRange) {
      this.timeRange = timeRange;
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    public QueryPlan build() {
      return new QueryPlan(tenantId, metrics, joins, dimensions, filters, timeRange, limit);
    }
  }

  @Override
  public String toString() {
    return "QueryPlan{tenantId=" + tenantId + ", metrics=" + metrics.size() + ", joins=" + joins.size()
        + ", dimensions=" + dimensions.size() + ", filters=" + filters.size()
        + ", timeRange=" + (timeRange == null ? "none" : timeRange.canonical())
        + ", limit=" + Objects.toString(limit, "default") + "}";
  }
}
