package io.intellixity.querywall.plan;

import java.util.Locale;

public enum FilterOperator {
  EQ("="),
  NE("!="),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),

  IN("IN"),
  NIN("NOT IN"),

  LIKE("LIKE"),
  RANGE("BETWEEN");

  private final String symbol;

  FilterOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** Accepts enum names ({@code eq}) as well as SQL symbols ({@code =}, {@code <>}, {@code not in}). */
  public static FilterOperator parse(String raw) {
    if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Blank filter operator");
    String s = raw.trim().toUpperCase(Locale.ROOT);
    if (s.equals("<>")) return NE;
    for (FilterOperator op : values()) {
      if (op.name().equals(s) || op.symbol.equals(s)) return op;
    }
    throw new IllegalArgumentException("Unknown filter operator: " + raw);
  }
}
