package io.intellixity.querywall.engine;

import java.time.Duration;

public record ExecutionOptions(long timeoutMs, int maxRows, String requestId) {
  public static final long DEFAULT_TIMEOUT_MS = 30_000L;
  public static final int DEFAULT_MAX_ROWS = 10_000;

  public ExecutionOptions {
    if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be > 0");
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
  }

  public static ExecutionOptions defaults() {
    return new ExecutionOptions(DEFAULT_TIMEOUT_MS, DEFAULT_MAX_ROWS, null);
  }

  public ExecutionOptions withRequestId(String requestId) {
    return new ExecutionOptions(timeoutMs, maxRows, requestId);
  }

  public Duration timeout() { return Duration.ofMillis(timeoutMs); }
}
