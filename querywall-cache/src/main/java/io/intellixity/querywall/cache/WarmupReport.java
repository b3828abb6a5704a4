package io.intellixity.querywall.cache;

/** Counts from one warmup run; {@code ran} is false when another run was already in progress. */
public record WarmupReport(boolean ran, int companies, int warmed, int skipped, int failed, long durationMs) {
  static WarmupReport notRun() {
    return new WarmupReport(false, 0, 0, 0, 0, 0);
  }
}
