package io.intellixity.querywall.plan;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical JSON deserializer for {@link QueryPlan}.
 * <p>
 * Accepts the translator's wire shape:
 * <pre>
 * {
 *   "tenantId": "...",
 *   "metrics": [{"metricId": "sroi_ratio", "aggregation": "avg"}],
 *   "joins": [{"from": "a", "to": "b"}],
 *   "dimensions": [{"table": "a", "column": "program"}],
 *   "filters": [{"column": "status", "operator": "eq", "value": "active"}],
 *   "timeRange": {"start": "2024-01-01", "end": "2024-06-30"},
 *   "limit": 100
 * }
 * </pre>
 * {@code metric}/{@code id}, {@code groupBy} and {@code field}/{@code op} are accepted as aliases.
 */
public final class QueryPlanJsonDeserializer extends JsonDeserializer<QueryPlan> {
  @Override
  public QueryPlan deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("QueryPlan JSON must be an object");

    List<MetricRef> metrics = new ArrayList<>();
    for (JsonNode m : arrayOf(root, "metrics")) {
      String id = firstText(m, "metricId", "metric", "id");
      if (id == null) throw new IllegalArgumentException("Metric entry without metricId: " + m);
      String agg = firstText(m, "aggregation", "agg");
      metrics.add(new MetricRef(id, Aggregation.parse(agg == null ? "sum" : agg)));
    }

    List<JoinEdge> joins = new ArrayList<>();
    for (JsonNode j : arrayOf(root, "joins")) {
      String from = firstText(j, "from", "fromTable");
      String to = firstText(j, "to", "toTable");
      if (from == null || to == null) throw new IllegalArgumentException("Join entry needs from/to: " + j);
      joins.add(new JoinEdge(from, to));
    }

    List<Dimension> dimensions = new ArrayList<>();
    JsonNode dimNode = root.has("dimensions") ? root.get("dimensions") : root.get("groupBy");
    if (dimNode != null && dimNode.isArray()) {
      for (JsonNode d : dimNode) {
        if (d.isTextual()) {
          dimensions.add(parseDimension(d.asText()));
          continue;
        }
        String column = firstText(d, "column", "field");
        if (column == null) throw new IllegalArgumentException("Dimension entry without column: " + d);
        dimensions.add(new Dimension(firstText(d, "table"), column));
      }
    }

    List<PlanFilter> filters = new ArrayList<>();
    for (JsonNode f : arrayOf(root, "filters")) {
      String column = firstText(f, "column", "field");
      if (column == null) throw new IllegalArgumentException("Filter entry without column: " + f);
      String op = firstText(f, "operator", "op");
      JsonNode v = f.get("value");
      Object value = (v == null || v.isNull()) ? null : codec.treeToValue(v, Object.class);
      filters.add(new PlanFilter(column, FilterOperator.parse(op == null ? "eq" : op), value));
    }

    TimeRange timeRange = null;
    JsonNode tr = root.get("timeRange");
    if (tr != null && tr.isObject()) {
      String start = firstText(tr, "start", "from");
      String end = firstText(tr, "end", "to");
      if (start != null && end != null) {
        timeRange = new TimeRange(TimeRange.parseBound(start), TimeRange.parseBound(end));
      }
    }

    Integer limit = null;
    JsonNode l = root.get("limit");
    if (l != null && l.canConvertToInt()) limit = l.asInt();

    return new QueryPlan(firstText(root, "tenantId", "companyId"), metrics, joins, dimensions, filters, timeRange, limit);
  }

  private static Dimension parseDimension(String raw) {
    int dot = raw.indexOf('.');
    if (dot <= 0) return new Dimension(null, raw);
    return new Dimension(raw.substring(0, dot), raw.substring(dot + 1));
  }

  private static Iterable<JsonNode> arrayOf(JsonNode root, String field) {
    JsonNode n = root.get(field);
    if (n == null || !n.isArray()) return List.of();
    return n;
  }

  private static String firstText(JsonNode n, String... fields) {
    for (String f : fields) {
      JsonNode v = n.get(f);
      if (v != null && !v.isNull()) return v.asText();
    }
    return null;
  }
}
