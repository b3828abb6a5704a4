package io.intellixity.querywall.engine;

/** The two shared stores a validated query can run against. */
public enum Backend {
  /** Row-oriented transactional store (PostgreSQL). */
  ROW_STORE("postgres"),
  /** Column-oriented analytical store (ClickHouse). */
  COLUMNAR("clickhouse");

  private final String id;

  Backend(String id) {
    this.id = id;
  }

  public String id() { return id; }
}
