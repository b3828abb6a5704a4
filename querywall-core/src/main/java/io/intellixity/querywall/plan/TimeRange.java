package io.intellixity.querywall.plan;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/** Half-open time window of a plan. */
public record TimeRange(Instant start, Instant end) {
  public TimeRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  public static TimeRange ofDates(LocalDate start, LocalDate end) {
    return new TimeRange(start.atStartOfDay(ZoneOffset.UTC).toInstant(), end.atStartOfDay(ZoneOffset.UTC).toInstant());
  }

  /** Parses {@code yyyy-MM-dd} or an ISO-8601 instant. */
  public static Instant parseBound(String raw) {
    Objects.requireNonNull(raw, "raw");
    String s = raw.trim();
    if (s.length() == 10) return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
    return Instant.parse(s);
  }

  public boolean isOrdered() {
    return start.isBefore(end);
  }

  /** Whole days covered by the window; 0 when the window is not ordered. */
  public long days() {
    if (!isOrdered()) return 0;
    return Duration.between(start, end).toDays();
  }

  /** Stable textual form, used as part of result cache keys. */
  public String canonical() {
    return start + "/" + end;
  }
}
