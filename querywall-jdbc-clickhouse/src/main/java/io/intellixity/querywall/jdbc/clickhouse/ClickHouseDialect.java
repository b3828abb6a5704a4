package io.intellixity.querywall.jdbc.clickhouse;

import io.intellixity.querywall.jdbc.dialect.AbstractJdbcDialect;

import java.math.BigInteger;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;

/**
 * ClickHouse dialect for the columnar store.\n
 *
 * The driver is a runtime dependency, so its value types are recognised by package name only.\n
 * Server error codes are reported as the native code.\n
 */
public final class ClickHouseDialect extends AbstractJdbcDialect {
  /** TIMEOUT_EXCEEDED, raised when max_execution_time fires. */
  static final int TIMEOUT_EXCEEDED = 159;
  /** QUERY_WAS_CANCELLED. */
  static final int QUERY_WAS_CANCELLED = 394;

  private static final String DRIVER_PACKAGE = "com.clickhouse.";

  @Override public String id() { return "clickhouse"; }

  @Override
  protected Object unwrapVendor(Object v) {
    // UnsignedByte/Short/Integer/Long
    if (v instanceof Number n && v.getClass().getName().startsWith(DRIVER_PACKAGE)) {
      return new BigInteger(n.toString());
    }
    return null;
  }

  @Override
  public String nativeCode(SQLException e) {
    if (e.getErrorCode() != 0) return String.valueOf(e.getErrorCode());
    return e.getSQLState();
  }

  @Override
  public boolean isTimeout(SQLException e) {
    if (e instanceof SQLTimeoutException) return true;
    int code = e.getErrorCode();
    return code == TIMEOUT_EXCEEDED || code == QUERY_WAS_CANCELLED;
  }
}
