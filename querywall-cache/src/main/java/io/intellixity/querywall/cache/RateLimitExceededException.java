package io.intellixity.querywall.cache;

import java.time.Duration;

/** A tenant used up its hourly query allowance. */
public final class RateLimitExceededException extends RuntimeException {
  private final String companyId;
  private final long limit;
  private final Duration retryAfter;

  public RateLimitExceededException(String companyId, long limit, Duration retryAfter) {
    super("Rate limit exceeded for tenant " + companyId + ": " + limit + " queries per hour");
    this.companyId = companyId;
    this.limit = limit;
    this.retryAfter = retryAfter;
  }

  public String companyId() {
    return companyId;
  }

  public long limit() {
    return limit;
  }

  /** Upper bound on the wait before the window resets. */
  public Duration retryAfter() {
    return retryAfter;
  }
}
