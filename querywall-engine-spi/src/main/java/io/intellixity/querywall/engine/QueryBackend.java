package io.intellixity.querywall.engine;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Backend SPI: runs one read-only statement against a single store.\n
 *
 * Implementations return raw driver values; normalization happens in the executor.\n
 * A backend must stop reading after {@code rowLimit} rows so the caller can detect overflow
 * without draining a huge result set.\n
 */
public interface QueryBackend {
  Backend backend();

  /**
   * @param sql      statement text, already validated
   * @param rowLimit maximum rows to read
   * @param timeout  statement timeout hint for the driver
   * @return rows as ordered column label to value maps
   * @throws QueryExecutionException on any backend failure
   */
  List<Map<String, Object>> fetch(String sql, int rowLimit, Duration timeout);

  /** Cheap reachability probe. Returns false instead of throwing. */
  boolean ping();
}
