package io.intellixity.querywall.engine;

/**
 * Backend failure surfaced to callers.\n
 *
 * {@code nativeCode} is the backend's own error code (SQLState for JDBC stores) when one exists.\n
 */
public class QueryExecutionException extends RuntimeException {
  private final Backend backend;
  private final String nativeCode;

  public QueryExecutionException(Backend backend, String nativeCode, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
    this.nativeCode = nativeCode;
  }

  public QueryExecutionException(Backend backend, String message) {
    this(backend, null, message, null);
  }

  public Backend backend() { return backend; }
  public String nativeCode() { return nativeCode; }
}
