package io.intellixity.querywall.plan;

import java.util.Locale;

/** Aggregation functions a plan may apply to a metric. */
public enum Aggregation {
  SUM,
  AVG,
  COUNT,
  COUNT_DISTINCT,
  MIN,
  MAX,
  MEDIAN;

  /** Distinct counts carry an extra cost and time penalty. */
  public boolean isDistinct() {
    return this == COUNT_DISTINCT;
  }

  /** Lenient parse: accepts {@code count_distinct}, {@code countDistinct}, {@code distinct_count}. */
  public static Aggregation parse(String raw) {
    if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Blank aggregation");
    String s = raw.trim().replace("-", "_");
    if (s.equalsIgnoreCase("countDistinct") || s.equalsIgnoreCase("distinct_count")
        || s.equalsIgnoreCase("uniq")) {
      return COUNT_DISTINCT;
    }
    return Aggregation.valueOf(s.toUpperCase(Locale.ROOT));
  }
}
