package io.intellixity.querywall.cache;

import java.util.List;
import java.util.Locale;

/**
 * Snapshot of cache effectiveness.
 *
 * @param hitRate hit percentage with two decimals
 */
public record CacheStats(long totalKeys,
                         long totalHits,
                         long totalMisses,
                         double hitRate,
                         long memoryUsedBytes,
                         long avgTtlSeconds,
                         List<TopQuery> topQueries) {
  public CacheStats {
    topQueries = topQueries == null ? List.of() : List.copyOf(topQueries);
  }

  public record TopQuery(String hash, long hits, String question) {}

  static CacheStats empty() {
    return new CacheStats(0, 0, 0, 0, 0, 0, List.of());
  }

  static double hitRate(long hits, long misses) {
    long total = hits + misses;
    if (total == 0) return 0;
    return Math.round((double) hits / total * 10_000) / 100.0;
  }

  public String memoryUsed() {
    return String.format(Locale.ROOT, "%.2f MB", memoryUsedBytes / 1024.0 / 1024.0);
  }
}
