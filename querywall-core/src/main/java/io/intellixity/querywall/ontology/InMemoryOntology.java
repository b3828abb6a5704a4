package io.intellixity.querywall.ontology;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querywall.plan.Aggregation;
import io.intellixity.querywall.plan.JoinEdge;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Simple in-memory {@link Ontology}.\n
 *
 * Loaded from a JSON document (see {@code querywall/ontology.json}) or built directly in tests.\n
 */
public final class InMemoryOntology implements Ontology {
  public static final String DEFAULT_RESOURCE = "querywall/ontology.json";

  private static final ObjectMapper JSON = new ObjectMapper();

  private final Map<String, MetricDefinition> metrics = new HashMap<>();
  private final Set<String> allowedJoins = new HashSet<>();
  private final Map<BudgetTier, QueryBudget> budgets = new EnumMap<>(BudgetTier.class);
  private final Set<String> piiColumns = new HashSet<>();

  public InMemoryOntology(Iterable<MetricDefinition> metrics,
                          Iterable<JoinEdge> allowedJoins,
                          Map<BudgetTier, QueryBudget> budgets,
                          Iterable<String> piiColumns) {
    for (MetricDefinition m : metrics) this.metrics.put(m.id(), m);
    for (JoinEdge j : allowedJoins) this.allowedJoins.add(j.undirectedKey());
    this.budgets.put(BudgetTier.STANDARD, QueryBudget.standard());
    this.budgets.put(BudgetTier.ENTERPRISE, QueryBudget.enterprise());
    if (budgets != null) this.budgets.putAll(budgets);
    for (String c : piiColumns) this.piiColumns.add(c.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public Optional<MetricDefinition> metric(String metricId) {
    if (metricId == null) return Optional.empty();
    return Optional.ofNullable(metrics.get(metricId));
  }

  @Override
  public boolean isJoinAllowed(JoinEdge join) {
    return join != null && allowedJoins.contains(join.undirectedKey());
  }

  @Override
  public QueryBudget budget(BudgetTier tier) {
    QueryBudget b = budgets.get(tier == null ? BudgetTier.STANDARD : tier);
    if (b == null) throw new IllegalArgumentException("No budget for tier: " + tier);
    return b;
  }

  @Override
  public Set<String> piiColumns() {
    return Set.copyOf(piiColumns);
  }

  /** Loads {@link #DEFAULT_RESOURCE} from the classpath. */
  public static InMemoryOntology loadDefault() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = InMemoryOntology.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
      return fromJson(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + DEFAULT_RESOURCE, e);
    }
  }

  public static InMemoryOntology fromJson(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    JsonNode root = JSON.readTree(in);
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Ontology JSON must be an object");

    Set<MetricDefinition> metrics = new LinkedHashSet<>();
    JsonNode ms = root.path("metrics");
    for (JsonNode m : ms) {
      Set<Aggregation> aggs = new LinkedHashSet<>();
      for (JsonNode a : m.path("allowedAggregations")) aggs.add(Aggregation.parse(a.asText()));
      Set<String> pii = new LinkedHashSet<>();
      for (JsonNode p : m.path("piiFields")) pii.add(p.asText());
      JsonNode maxDays = m.get("maxTimeRangeDays");
      metrics.add(new MetricDefinition(
          m.path("id").asText(),
          m.path("sourceTable").asText(),
          aggs,
          pii,
          m.path("costWeight").asDouble(1.0),
          (maxDays == null || maxDays.isNull()) ? null : maxDays.asInt(),
          m.path("enabled").asBoolean(true)));
    }

    Set<JoinEdge> joins = new LinkedHashSet<>();
    for (JsonNode j : root.path("allowedJoins")) {
      joins.add(new JoinEdge(j.path("from").asText(), j.path("to").asText()));
    }

    Map<BudgetTier, QueryBudget> budgets = new EnumMap<>(BudgetTier.class);
    JsonNode bs = root.path("budgets");
    var it = bs.fields();
    while (it.hasNext()) {
      var e = it.next();
      JsonNode b = e.getValue();
      budgets.put(BudgetTier.parse(e.getKey()), new QueryBudget(
          b.path("maxJoins").asInt(),
          b.path("maxGroupByDimensions").asInt(),
          b.path("maxRowsReturned").asInt(),
          b.path("defaultLimit").asInt(1_000),
          b.path("maxCostPoints").asDouble(),
          b.path("maxExecutionTimeMs").asLong()));
    }

    Set<String> pii = new LinkedHashSet<>();
    for (JsonNode p : root.path("piiColumns")) pii.add(p.asText());

    return new InMemoryOntology(metrics, joins, budgets, pii);
  }
}
