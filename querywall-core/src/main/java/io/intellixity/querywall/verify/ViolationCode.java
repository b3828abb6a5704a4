package io.intellixity.querywall.verify;

/** Stable codes reported by the guardrail validator and the plan verifier. */
public enum ViolationCode {
  // query text guardrails
  TNT_001(Severity.CRITICAL, "Missing or incorrect tenant filter"),
  TNT_002(Severity.CRITICAL, "Potential tenant filter bypass"),
  INJ_001(Severity.CRITICAL, "SQL injection pattern"),
  UNION_001(Severity.HIGH, "UNION clause not allowed"),
  CMT_001(Severity.MEDIUM, "Inline SQL comment"),
  FUNC_001(Severity.CRITICAL, "Dangerous function or dynamic execution"),
  EXFIL_001(Severity.CRITICAL, "Data exfiltration pattern"),
  TBL_001(Severity.CRITICAL, "Table not permitted for role"),
  PII_001(Severity.CRITICAL, "PII column referenced"),
  JOIN_001(Severity.HIGH, "Join not on allow-list"),
  WHERE_001(Severity.HIGH, "Read query without WHERE clause"),
  NEST_001(Severity.MEDIUM, "Nested query depth exceeds limit"),
  LIMIT_001(Severity.MEDIUM, "Missing LIMIT clause"),
  LIMIT_002(Severity.MEDIUM, "LIMIT exceeds maximum"),
  TIME_001(Severity.MEDIUM, "Time window exceeds limit"),

  // structural plan checks
  PLAN_TENANT(Severity.CRITICAL, "Plan has no tenant id"),
  PLAN_METRIC_UNKNOWN(Severity.HIGH, "Unknown or disallowed metric"),
  PLAN_AGG_NOT_ALLOWED(Severity.HIGH, "Aggregation not allowed for metric"),
  PLAN_JOIN_NOT_ALLOWED(Severity.HIGH, "Join not on allow-list"),
  PLAN_JOIN_CYCLE(Severity.HIGH, "Join graph contains a cycle"),
  PLAN_TOO_MANY_JOINS(Severity.MEDIUM, "Too many joins"),
  PLAN_TOO_MANY_DIMENSIONS(Severity.MEDIUM, "Too many group-by dimensions"),
  PLAN_LIMIT_EXCEEDED(Severity.MEDIUM, "Row limit exceeds budget"),
  PLAN_TIME_INVALID(Severity.MEDIUM, "Time range start must precede end"),
  PLAN_TIME_METRIC_MAX(Severity.MEDIUM, "Time range exceeds metric maximum"),
  PLAN_TIME_ABSOLUTE_MAX(Severity.MEDIUM, "Time range exceeds absolute maximum"),
  PLAN_FILTER_INJECTION(Severity.CRITICAL, "Injection pattern in filter value"),
  PLAN_COST_EXCEEDED(Severity.MEDIUM, "Estimated cost exceeds budget"),

  // advisory
  PII_REDACTION_REQUIRED(Severity.WARNING, "Result contains PII fields and requires redaction"),
  TIME_ESTIMATE_EXCEEDED(Severity.WARNING, "Estimated execution time exceeds budget");

  private final Severity defaultSeverity;
  private final String title;

  ViolationCode(Severity defaultSeverity, String title) {
    this.defaultSeverity = defaultSeverity;
    this.title = title;
  }

  public Severity defaultSeverity() {
    return defaultSeverity;
  }

  public String title() {
    return title;
  }
}
