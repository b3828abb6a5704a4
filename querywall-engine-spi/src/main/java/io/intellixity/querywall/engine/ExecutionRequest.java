package io.intellixity.querywall.engine;

/**
 * What to run. When {@code analyticalQuery} is present it wins and goes to the columnar store,
 * otherwise {@code sql} goes to the row store.
 */
public record ExecutionRequest(String sql, String analyticalQuery) {
  public ExecutionRequest {
    sql = blankToNull(sql);
    analyticalQuery = blankToNull(analyticalQuery);
    if (sql == null && analyticalQuery == null) {
      throw new IllegalArgumentException("sql or analyticalQuery is required");
    }
  }

  public static ExecutionRequest sql(String sql) {
    return new ExecutionRequest(sql, null);
  }

  public static ExecutionRequest analytical(String analyticalQuery) {
    return new ExecutionRequest(null, analyticalQuery);
  }

  public Backend target() {
    return analyticalQuery != null ? Backend.COLUMNAR : Backend.ROW_STORE;
  }

  public String statement() {
    return analyticalQuery != null ? analyticalQuery : sql;
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }
}
