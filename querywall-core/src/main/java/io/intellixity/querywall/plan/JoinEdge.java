package io.intellixity.querywall.plan;

import java.util.Locale;
import java.util.Objects;

/** Directed join between two tables as requested by a plan. */
public record JoinEdge(String from, String to) {
  public JoinEdge {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }

  /** Order-insensitive, lower-cased identity used for allow-list lookups. */
  public String undirectedKey() {
    String a = from.toLowerCase(Locale.ROOT);
    String b = to.toLowerCase(Locale.ROOT);
    return a.compareTo(b) <= 0 ? a + "<->" + b : b + "<->" + a;
  }
}
