package io.intellixity.querywall.jdbc;

import io.intellixity.querywall.engine.Backend;
import io.intellixity.querywall.engine.QueryBackend;
import io.intellixity.querywall.engine.QueryExecutionException;
import io.intellixity.querywall.engine.QueryTimeoutException;
import io.intellixity.querywall.jdbc.dialect.JdbcDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link QueryBackend} over a pooled JDBC store.\n
 *
 * Statements run on read-only connections with the driver timeout and max-rows set, so an abandoned
 * attempt is cancelled by the database rather than left running.\n
 */
public final class JdbcQueryBackend implements QueryBackend {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryBackend.class);

  private final Backend backend;
  private final JdbcHandle handle;
  private final JdbcDialect dialect;

  public JdbcQueryBackend(Backend backend, JdbcHandle handle, JdbcDialect dialect) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override public Backend backend() { return backend; }

  public JdbcHandle handle() { return handle; }
  public JdbcDialect dialect() { return dialect; }

  @Override
  public List<Map<String, Object>> fetch(String sql, int rowLimit, Duration timeout) {
    Objects.requireNonNull(sql, "sql");
    debugSql(sql, rowLimit, timeout);
    long t0 = System.nanoTime();
    try (Connection c = handle.client().getConnection()) {
      c.setReadOnly(true);
      if (handle.schema() != null) c.setSchema(handle.schema());
      try (Statement st = c.createStatement()) {
        dialect.applyLimits(st, rowLimit, timeout);
        try (ResultSet rs = st.executeQuery(sql)) {
          JdbcRowReader reader = new JdbcRowReader(rs, dialect);
          List<Map<String, Object>> rows = new ArrayList<>();
          while (rows.size() < rowLimit && rs.next()) {
            rows.add(reader.read());
          }
          debugDone(rows.size(), System.nanoTime() - t0);
          return rows;
        }
      }
    } catch (SQLException e) {
      throw translate(e, timeout);
    }
  }

  private QueryExecutionException translate(SQLException e, Duration timeout) {
    if (dialect.isTimeout(e)) {
      long ms = timeout == null ? 0L : timeout.toMillis();
      log.warn("querywall.jdbc op=timeout handleId={} timeoutMs={}", handle.id(), ms);
      return new QueryTimeoutException(backend, ms, e);
    }
    String code = dialect.nativeCode(e);
    log.warn("querywall.jdbc op=error handleId={} dialect={} nativeCode={} message={}",
        handle.id(), dialect.id(), code, e.getMessage());
    return new QueryExecutionException(backend, code, backend.id() + " query failed: " + e.getMessage(), e);
  }

  @Override
  public boolean ping() {
    try (Connection c = handle.client().getConnection();
         Statement st = c.createStatement()) {
      st.setQueryTimeout(5);
      try (ResultSet rs = st.executeQuery(dialect.pingSql())) {
        return rs.next();
      }
    } catch (SQLException | RuntimeException e) {
      log.warn("querywall.jdbc op=ping handleId={} error={}", handle.id(), e.toString());
      return false;
    }
  }

  private void debugSql(String sql, int rowLimit, Duration timeout) {
    if (!log.isDebugEnabled()) return;
    log.debug("querywall.jdbc op=fetch backend={} dialect={} handleId={} schema={} rowLimit={} timeoutMs={} sql={}",
        backend.id(), dialect.id(), handle.id(), handle.schema(), rowLimit,
        timeout == null ? "null" : timeout.toMillis(), sql);
  }

  private void debugDone(int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("querywall.jdbc_done op=fetch backend={} handleId={} durationMs={} rows={}",
        backend.id(), handle.id(), durationNanos / 1_000_000.0, rows);
  }
}
