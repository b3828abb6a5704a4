package io.intellixity.querywall.engine;

/** Reachability of both stores as reported by {@code QueryExecutor.testConnection()}. */
public record ConnectionStatus(boolean rowStore, boolean columnar) {
  public boolean allReachable() {
    return rowStore && columnar;
  }
}
