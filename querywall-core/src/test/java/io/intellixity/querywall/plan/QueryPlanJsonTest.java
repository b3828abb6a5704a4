package io.intellixity.querywall.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryPlanJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesTranslatorShape() throws Exception {
    String s = """
        {
          "tenantId": "tenant-1",
          "metrics": [ { "metricId": "sroi_ratio", "aggregation": "avg" },
                       { "metric": "active_participants", "agg": "countDistinct" } ],
          "joins": [ { "from": "metrics_company_period", "to": "outcome_scores" } ],
          "dimensions": [ { "table": "outcome_scores", "column": "program" }, "metrics_company_period.period_start" ],
          "filters": [ { "column": "status", "operator": "=", "value": "active" },
                       { "field": "program", "op": "in", "value": ["a", "b"] } ],
          "timeRange": { "start": "2024-01-01", "end": "2024-04-01" },
          "limit": 250
        }
        """;
    QueryPlan p = JSON.readValue(s, QueryPlan.class);

    assertEquals("tenant-1", p.tenantId());
    assertEquals(2, p.metrics().size());
    assertEquals(Aggregation.COUNT_DISTINCT, p.metrics().get(1).aggregation());
    assertEquals("outcome_scores", p.joins().get(0).to());
    assertEquals("metrics_company_period.period_start", p.dimensions().get(1).qualifiedName());
    assertEquals(FilterOperator.EQ, p.filters().get(0).operator());
    assertEquals(FilterOperator.IN, p.filters().get(1).operator());
    assertEquals(List.of("a", "b"), p.filters().get(1).value());
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), p.timeRange().start());
    assertEquals(91, p.timeRange().days());
    assertEquals(250, p.limit());
  }

  @Test
  void missingSectionsDefaultToEmpty() throws Exception {
    QueryPlan p = JSON.readValue("{ \"companyId\": \"t2\" }", QueryPlan.class);
    assertEquals("t2", p.tenantId());
    assertTrue(p.metrics().isEmpty());
    assertTrue(p.joins().isEmpty());
    assertNull(p.timeRange());
    assertNull(p.limit());
  }

  @Test
  void rejectsUnknownOperator() {
    String s = """
        { "tenantId": "t", "filters": [ { "column": "x", "operator": "regex", "value": "y" } ] }
        """;
    assertThrows(Exception.class, () -> JSON.readValue(s, QueryPlan.class));
  }
}
