package io.intellixity.querywall.jdbc.dialect;

/** Plain JDBC behavior with no driver-specific types. */
public final class AnsiJdbcDialect extends AbstractJdbcDialect {
  @Override public String id() { return "ansi"; }
}
