package io.intellixity.querywall.cache;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Logical identity of a cached result.
 *
 * @param accessScope the caller's policy scope (role); results visible to one role are never served to another
 * @param statement   the query text actually executed, empty when unknown
 * @param timeRange   canonical time range text ({@code TimeRange.canonical()} or a named window such as {@code last_quarter})
 */
public record CacheKeyInput(String question, String companyId, String accessScope, String statement,
                            String timeRange, Map<String, Object> filters) {
  public CacheKeyInput {
    Objects.requireNonNull(question, "question");
    CacheKeys.requireTenant(companyId);
    accessScope = accessScope == null ? "" : accessScope.trim().toLowerCase(Locale.ROOT);
    statement = statement == null ? "" : statement;
    timeRange = timeRange == null ? "" : timeRange;
    // sorted so insertion order never reaches the digest
    filters = Collections.unmodifiableMap(filters == null ? new TreeMap<>() : new TreeMap<>(filters));
  }

  public CacheKeyInput(String question, String companyId, String timeRange, Map<String, Object> filters) {
    this(question, companyId, null, null, timeRange, filters);
  }

  public String normalizedQuestion() {
    return question.trim().toLowerCase(Locale.ROOT);
  }

  /** Whitespace runs collapsed; case is kept because literals are case-sensitive. */
  public String normalizedStatement() {
    return statement.trim().replaceAll("\\s+", " ");
  }
}
