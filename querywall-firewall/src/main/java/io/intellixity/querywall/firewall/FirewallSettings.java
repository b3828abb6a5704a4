package io.intellixity.querywall.firewall;

import java.time.Duration;

/** Execution and caching defaults applied to every request. */
public record FirewallSettings(long timeoutMs, int maxRows, Duration cacheTtl) {
  public FirewallSettings {
    if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be > 0");
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
  }

  public static FirewallSettings defaults() {
    return new FirewallSettings(30_000L, 10_000, Duration.ofHours(1));
  }
}
