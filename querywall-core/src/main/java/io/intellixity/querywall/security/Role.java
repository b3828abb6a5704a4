package io.intellixity.querywall.security;

import java.util.Locale;

/** Closed set of caller roles; anything unrecognised is treated as {@link #VIEWER}. */
public enum Role {
  VIEWER,
  ANALYST,
  COMPANY_ADMIN,
  SYSTEM_ADMIN;

  /** Case-insensitive; accepts {@code system-admin} and {@code systemAdmin} spellings. */
  public static Role parse(String raw) {
    if (raw == null || raw.isBlank()) return VIEWER;
    String s = raw.trim()
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .replace('-', '_')
        .toUpperCase(Locale.ROOT);
    for (Role r : values()) {
      if (r.name().equals(s)) return r;
    }
    return VIEWER;
  }
}
