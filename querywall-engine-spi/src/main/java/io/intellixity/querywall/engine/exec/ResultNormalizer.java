package io.intellixity.querywall.engine.exec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts raw driver values into the canonical result shape.\n
 *
 * Rules:\n
 * - null stays null\n
 * - temporal values and timestamp-like strings become ISO-8601 UTC instants ({@code 2024-01-15T10:00:00Z});
 *   date-only values and strings become UTC midnight, the same as {@link LocalDate}\n
 * - non-integer numbers are rounded to 4 decimals, HALF_UP\n
 * - 64-bit integers become {@code long}, or {@code double} outside +/-(2^53 - 1)\n
 * - anything else is returned unchanged\n
 *
 * Applying {@link #normalizeRows(List)} to its own output returns equal data.\n
 */
public final class ResultNormalizer {
  public static final int DECIMAL_SCALE = 4;
  public static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

  private static final BigInteger SAFE_MAX = BigInteger.valueOf(MAX_SAFE_INTEGER);
  private static final BigInteger SAFE_MIN = SAFE_MAX.negate();

  private static final Pattern TIMESTAMP_LIKE = Pattern.compile(
      "\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d{1,9})?)?(Z|[+-]\\d{2}(?::?\\d{2})?)?");

  private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private ResultNormalizer() {}

  public static List<Map<String, Object>> normalizeRows(List<Map<String, Object>> rows) {
    if (rows == null || rows.isEmpty()) return List.of();
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      out.add(normalizeRow(row));
    }
    return Collections.unmodifiableList(out);
  }

  public static Map<String, Object> normalizeRow(Map<String, Object> row) {
    if (row == null) return Map.of();
    Map<String, Object> out = new LinkedHashMap<>(Math.max(4, row.size() * 2));
    for (var e : row.entrySet()) {
      out.put(e.getKey(), normalizeValue(e.getValue()));
    }
    return Collections.unmodifiableMap(out);
  }

  public static Object normalizeValue(Object v) {
    if (v == null) return null;

    if (v instanceof String s) return normalizeString(s);

    if (v instanceof Long l) return safeInteger(l);
    if (v instanceof BigInteger bi) return safeInteger(bi);
    if (v instanceof BigDecimal bd) return normalizeDecimal(bd);
    if (v instanceof Double d) return roundDouble(d);
    if (v instanceof Float f) return Float.isFinite(f) ? roundDecimal(new BigDecimal(Float.toString(f))) : f;

    if (v instanceof Instant i) return i.toString();
    if (v instanceof OffsetDateTime odt) return odt.toInstant().toString();
    if (v instanceof ZonedDateTime zdt) return zdt.toInstant().toString();
    if (v instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC).toString();
    if (v instanceof LocalDate ld) return ld.atStartOfDay().toInstant(ZoneOffset.UTC).toString();
    if (v instanceof java.sql.Timestamp ts) return ts.toInstant().toString();
    // java.sql.Date/Time do not support toInstant()
    if (v instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC).toString();
    if (v instanceof java.sql.Time t) return t.toString();
    if (v instanceof java.util.Date d) return d.toInstant().toString();

    if (v instanceof Map<?, ?> m) {
      Map<Object, Object> out = new LinkedHashMap<>();
      m.forEach((k, val) -> out.put(k, normalizeValue(val)));
      return Collections.unmodifiableMap(out);
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(normalizeValue(o));
      return Collections.unmodifiableList(out);
    }
    return v;
  }

  static boolean isTimestampLike(String s) {
    return TIMESTAMP_LIKE.matcher(s).matches();
  }

  private static Object normalizeString(String s) {
    if (DATE_ONLY.matcher(s).matches()) {
      try {
        return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC).toString();
      } catch (DateTimeParseException e) {
        return s;
      }
    }
    if (!isTimestampLike(s)) return s;
    String iso = s.replace(' ', 'T');
    var m = TIMESTAMP_LIKE.matcher(s);
    String offset = m.matches() ? m.group(1) : null;
    try {
      if (offset == null) {
        return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC).toString();
      }
      if (!"Z".equals(offset) && offset.indexOf(':') < 0) {
        // +05 / +0530 -> +05:00 / +05:30
        String fixed = offset.length() == 3 ? offset + ":00" : offset.substring(0, 3) + ":" + offset.substring(3);
        iso = iso.substring(0, iso.length() - offset.length()) + fixed;
      }
      return OffsetDateTime.parse(iso).toInstant().toString();
    } catch (DateTimeParseException e) {
      // e.g. 2024-13-45 10:00; not a real timestamp, keep the text
      return s;
    }
  }

  private static Object safeInteger(long l) {
    if (l > MAX_SAFE_INTEGER || l < -MAX_SAFE_INTEGER) return (double) l;
    return l;
  }

  private static Object safeInteger(BigInteger bi) {
    if (bi.compareTo(SAFE_MAX) > 0 || bi.compareTo(SAFE_MIN) < 0) return bi.doubleValue();
    return bi.longValue();
  }

  private static Object normalizeDecimal(BigDecimal bd) {
    if (bd.signum() == 0 || bd.scale() <= 0 || bd.stripTrailingZeros().scale() <= 0) {
      return safeInteger(bd.toBigInteger());
    }
    return roundDecimal(bd);
  }

  private static Object roundDouble(double d) {
    if (!Double.isFinite(d) || d == Math.rint(d)) return d;
    return roundDecimal(BigDecimal.valueOf(d));
  }

  private static double roundDecimal(BigDecimal bd) {
    return bd.setScale(DECIMAL_SCALE, RoundingMode.HALF_UP).doubleValue();
  }
}
