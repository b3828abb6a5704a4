package io.intellixity.querywall.engine;

public final class QueryTimeoutException extends QueryExecutionException {
  private final long timeoutMs;

  public QueryTimeoutException(Backend backend, long timeoutMs) {
    this(backend, timeoutMs, null);
  }

  public QueryTimeoutException(Backend backend, long timeoutMs, Throwable cause) {
    super(backend, null, "Query exceeded timeout of " + timeoutMs + "ms on " + backend.id(), cause);
    this.timeoutMs = timeoutMs;
  }

  public long timeoutMs() { return timeoutMs; }
}
