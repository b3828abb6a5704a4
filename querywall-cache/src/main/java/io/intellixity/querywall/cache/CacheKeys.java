package io.intellixity.querywall.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.intellixity.querywall.cache.internal.Globs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Key layout in the cache store.
 * <ul>
 *   <li>entries: {@code nlq:<tenant>:<sha256>}</li>
 *   <li>locks: {@code nlq:lock:<entry key>}</li>
 *   <li>counters: {@code nlq:stats:*}, {@code nlq:ratelimit:*}</li>
 * </ul>
 * Tenant ids containing {@code :} or equal to a reserved segment are rejected, so one tenant's pattern
 * can never match another tenant's keys or the bookkeeping namespaces.
 */
public final class CacheKeys {
  public static final String PREFIX = "nlq";
  public static final String LOCK_PREFIX = PREFIX + ":lock";
  public static final String STATS_PREFIX = PREFIX + ":stats";
  public static final String RATE_LIMIT_PREFIX = PREFIX + ":ratelimit";

  static final String HITS_KEY = STATS_PREFIX + ":hits";
  static final String MISSES_KEY = STATS_PREFIX + ":misses";
  static final String QUERY_HITS_PREFIX = STATS_PREFIX + ":query:";
  static final String QUERY_TEXT_PREFIX = STATS_PREFIX + ":question:";

  private static final Set<String> RESERVED_SEGMENTS = Set.of("lock", "stats", "ratelimit");

  private static final Pattern HASH = Pattern.compile("[0-9a-f]{64}");
  private static final ObjectMapper JSON = JsonMapper.builder()
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .build();

  private CacheKeys() {}

  /** Deterministic entry key; the tenant id is both hashed and visible in the prefix. */
  public static String generate(CacheKeyInput in) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("normalizedQuestion", in.normalizedQuestion());
    payload.put("companyId", in.companyId());
    payload.put("accessScope", in.accessScope());
    payload.put("statementHash", in.statement().isEmpty() ? "" : sha256Hex(in.normalizedStatement()));
    payload.put("timeRange", in.timeRange());
    payload.put("filters", in.filters());
    String json;
    try {
      json = JSON.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cache key filters are not serializable", e);
    }
    return PREFIX + ":" + in.companyId() + ":" + sha256Hex(json);
  }

  /** Last key segment, the query hash. */
  public static String extractQueryHash(String cacheKey) {
    int i = cacheKey.lastIndexOf(':');
    return i < 0 ? cacheKey : cacheKey.substring(i + 1);
  }

  public static String lockKey(String cacheKey) {
    return LOCK_PREFIX + ":" + cacheKey;
  }

  public static String tenantPattern(String tenantId) {
    requireTenant(tenantId);
    return PREFIX + ":" + Globs.escape(tenantId) + ":*";
  }

  public static String allPattern() {
    return PREFIX + ":*";
  }

  /** True for result entries; false for locks, counters and anything not shaped like an entry key. */
  public static boolean isEntryKey(String key) {
    if (!key.startsWith(PREFIX + ":")) return false;
    if (key.startsWith(LOCK_PREFIX + ":") || key.startsWith(STATS_PREFIX + ":")
        || key.startsWith(RATE_LIMIT_PREFIX + ":")) {
      return false;
    }
    return HASH.matcher(extractQueryHash(key)).matches();
  }

  /** Tenant ids become a key segment; reject those that would alias another namespace. */
  public static String requireTenant(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenant id is required");
    }
    if (tenantId.indexOf(':') >= 0) {
      throw new IllegalArgumentException("tenant id must not contain ':': " + tenantId);
    }
    if (RESERVED_SEGMENTS.contains(tenantId.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException("tenant id is reserved: " + tenantId);
    }
    return tenantId;
  }

  static String sha256Hex(String s) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
