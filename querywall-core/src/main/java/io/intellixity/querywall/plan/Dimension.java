package io.intellixity.querywall.plan;

import java.util.Objects;

/** GROUP BY column. */
public record Dimension(String table, String column) {
  public Dimension {
    Objects.requireNonNull(column, "column");
  }

  public String qualifiedName() {
    return (table == null || table.isBlank()) ? column : table + "." + column;
  }
}
