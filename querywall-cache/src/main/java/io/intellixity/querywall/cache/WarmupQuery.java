package io.intellixity.querywall.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A common question pre-computed by {@link CacheWarmer}.
 *
 * @param ttl entry TTL, null for the cache default
 */
public record WarmupQuery(String question, String templateId, String timeRange, Map<String, Object> filters,
                          Duration ttl) {
  public WarmupQuery {
    Objects.requireNonNull(question, "question");
    Objects.requireNonNull(templateId, "templateId");
    filters = filters == null ? Map.of() : Map.copyOf(filters);
  }

  public static WarmupQuery of(String question, String templateId, String timeRange) {
    return new WarmupQuery(question, templateId, timeRange, Map.of(), null);
  }

  CacheKeyInput keyFor(String companyId) {
    return new CacheKeyInput(question, companyId, timeRange, filters);
  }
}
