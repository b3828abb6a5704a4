package io.intellixity.querywall.jdbc.postgres;

import io.intellixity.querywall.jdbc.dialect.AbstractJdbcDialect;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;

/**
 * Postgres dialect for the row store.
 *
 * Keeps only Postgres-specific value unwrapping and error classification.\n
 * Generic unwrapping lives in {@link AbstractJdbcDialect}.
 */
public final class PostgresDialect extends AbstractJdbcDialect {
  /** SQLSTATE for query_canceled, raised when statement_timeout fires. */
  static final String QUERY_CANCELED = "57014";

  @Override public String id() { return "postgres"; }

  @Override
  protected Object unwrapVendor(Object v) {
    // json, jsonb, interval, inet, money...: the server's text form
    if (v instanceof PGobject pg) return pg.getValue();
    return null;
  }

  @Override
  public boolean isTimeout(SQLException e) {
    return e instanceof SQLTimeoutException || QUERY_CANCELED.equals(e.getSQLState());
  }
}
