package io.intellixity.querywall.engine;

/** Result exceeded the row cap. Results are never truncated. */
public final class TooManyRowsException extends QueryExecutionException {
  private final int maxRows;

  public TooManyRowsException(Backend backend, int maxRows) {
    super(backend, null, "Query returned more than " + maxRows + " rows on " + backend.id(), null);
    this.maxRows = maxRows;
  }

  public int maxRows() { return maxRows; }
}
