package io.intellixity.querywall.jdbc.dialect;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;

/** Store-specific JDBC behavior: value unwrapping, limits and error classification. */
public interface JdbcDialect {
  String id();

  default String pingSql() { return "SELECT 1"; }

  /** Reads one column of the current row as a plain Java value. */
  Object readValue(ResultSet rs, int column) throws SQLException;

  /** Applies the driver-side timeout and row cap before execution. */
  default void applyLimits(Statement st, int rowLimit, Duration timeout) throws SQLException {
    if (timeout != null && !timeout.isZero()) {
      long secs = Math.max(1L, (timeout.toMillis() + 999L) / 1000L);
      st.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, secs));
    }
    st.setMaxRows(rowLimit);
  }

  /** Backend-native error code carried on {@code QueryExecutionException}. */
  default String nativeCode(SQLException e) {
    return e.getSQLState();
  }

  default boolean isTimeout(SQLException e) {
    return e instanceof SQLTimeoutException;
  }
}
