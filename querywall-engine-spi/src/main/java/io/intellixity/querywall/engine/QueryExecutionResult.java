package io.intellixity.querywall.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Normalized rows plus execution metadata. Created per execution and never shared. */
public record QueryExecutionResult(List<Map<String, Object>> rows, Metadata metadata) {
  public QueryExecutionResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
    Objects.requireNonNull(metadata, "metadata");
  }

  public record Metadata(int rowCount,
                         long executionTimeMs,
                         long estimatedBytes,
                         Backend backend,
                         boolean cached,
                         String requestId) {}

  /**
   * Copy as served to the request {@code requestId}. A cached payload carries the request id of the
   * call that computed it; the copy carries the current one.
   */
  public QueryExecutionResult withCached(boolean cached, String requestId) {
    if (metadata.cached() == cached && Objects.equals(metadata.requestId(), requestId)) return this;
    return new QueryExecutionResult(rows, new Metadata(
        metadata.rowCount(), metadata.executionTimeMs(), metadata.estimatedBytes(),
        metadata.backend(), cached, requestId));
  }
}
