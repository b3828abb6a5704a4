package io.intellixity.querywall.security;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Per-request authorization context. Built fresh for every request and never persisted.
 *
 * @param allowedTables explicit allow-list, ignored when {@code allTablesAllowed} is set
 */
public record SecurityContext(String companyId,
                              Role role,
                              boolean allTablesAllowed,
                              Set<String> allowedTables,
                              Set<String> deniedTables,
                              RateLimits rateLimits) {
  public SecurityContext {
    Objects.requireNonNull(companyId, "companyId");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(rateLimits, "rateLimits");
    allowedTables = allowedTables == null ? Set.of() : Set.copyOf(allowedTables);
    deniedTables = deniedTables == null ? Set.of() : Set.copyOf(deniedTables);
  }

  /** Only the system admin role may skip row-level tenant filtering. */
  public boolean bypassesRowFilter() {
    return role == Role.SYSTEM_ADMIN;
  }

  public boolean canAccessTable(String table) {
    if (table == null) return false;
    String t = table.trim().toLowerCase(Locale.ROOT);
    int dot = t.lastIndexOf('.');
    if (dot >= 0) t = t.substring(dot + 1);
    if (deniedTables.contains(t)) return false;
    return allTablesAllowed || allowedTables.contains(t);
  }
}
