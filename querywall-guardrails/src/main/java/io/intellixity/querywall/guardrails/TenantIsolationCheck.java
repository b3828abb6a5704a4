package io.intellixity.querywall.guardrails;

import io.intellixity.querywall.security.SecurityContext;
import io.intellixity.querywall.verify.VerificationResult;
import io.intellixity.querywall.verify.ViolationCode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tenant isolation rules over query text.
 * <p>
 * Every predicate on the tenant column must be an equality against the caller's own tenant id, and
 * every SELECT scope (the statement, scalar subqueries, derived tables, CTE bodies) that reads a table
 * must carry such an equality itself. A statement scoped to the tenant must not contain an {@code OR}.
 * Canonical UUID literals compare case-insensitively; every other literal must match exactly.
 */
final class TenantIsolationCheck {
  private static final Pattern OR = Pattern.compile("\\bor\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern EQ_LITERAL = Pattern.compile("\\s*(==|=)\\s*(?:'([^']*)'|\"([^\"]*)\"|([\\w.\\-]+))");
  private static final Pattern NEGATED = Pattern.compile("\\s*(!=|<>|\\^=)");
  private static final Pattern SET_OR_PATTERN = Pattern.compile("\\s+(not\\s+in|in|not\\s+like|like|ilike|is|between|similar\\s+to)\\b",
      Pattern.CASE_INSENSITIVE);

  private final Pattern column;
  private final Pattern columnOnly;

  TenantIsolationCheck(String tenantColumn) {
    Objects.requireNonNull(tenantColumn, "tenantColumn");
    String c = Pattern.quote(tenantColumn);
    this.column = Pattern.compile("(?<![\\w.])(?:\\w+\\.)?" + c + "(?!\\w)", Pattern.CASE_INSENSITIVE);
    this.columnOnly = Pattern.compile("(?:\\w+\\.)?" + c, Pattern.CASE_INSENSITIVE);
  }

  void check(String sql, SecurityContext ctx, VerificationResult.Builder out) {
    if (ctx.bypassesRowFilter()) return;

    String masked = SqlText.maskLiterals(sql);
    String tenant = ctx.companyId();
    Set<String> cteNames = SqlText.cteNames(masked);

    int matchingFilters = 0;
    List<String> problems = new ArrayList<>();

    List<SqlText.Scope> scopes = SqlText.selectScopes(masked);
    for (SqlText.Scope scope : scopes) {
      String own = SqlText.ownText(masked, scope, scopes);
      Predicates found = scanPredicates(sql, own, tenant, problems);
      matchingFilters += found.matching;
      if (found.total > 0) continue;

      Set<String> tables = new LinkedHashSet<>();
      for (SqlText.TableRef ref : SqlText.tableRefs(own, cteNames)) tables.add(ref.name());
      if (tables.isEmpty()) continue;
      problems.add(scope.topLevel()
          ? "missing tenant filter (expected: " + tenant + ")"
          : "subquery reading " + tables + " has no tenant filter");
    }

    if (matchingFilters == 0 && problems.isEmpty()) {
      problems.add("missing tenant filter (expected: " + tenant + ")");
    }
    if (!problems.isEmpty()) {
      out.violation(ViolationCode.TNT_001, "Missing or incorrect tenant filter: " + String.join("; ", problems));
    }

    if (matchingFilters > 0 && OR.matcher(masked).find()) {
      out.violation(ViolationCode.TNT_002, "Potential tenant filter bypass: OR clause in tenant-scoped statement");
    }
  }

  private static final class Predicates {
    int matching;
    int total;
  }

  /** Tenant-column predicates in one scope's own text; {@code sql} supplies the literal values at the same offsets. */
  private Predicates scanPredicates(String sql, String own, String tenant, List<String> problems) {
    Predicates found = new Predicates();
    Matcher m = column.matcher(own);
    while (m.find()) {
      int after = m.end();

      Matcher eq = EQ_LITERAL.matcher(sql);
      eq.region(after, sql.length());
      if (eq.lookingAt()) {
        String quoted = eq.group(2) != null ? eq.group(2) : eq.group(3);
        String bare = eq.group(4);
        if (quoted == null && bare != null && columnOnly.matcher(bare).matches()) {
          continue; // join condition between two tenant columns
        }
        found.total++;
        String literal = quoted != null ? quoted : bare;
        if (sameTenant(literal, tenant)) {
          found.matching++;
        } else {
          problems.add("tenant filter value '" + literal + "' does not match caller tenant");
        }
        continue;
      }

      Matcher neg = NEGATED.matcher(own);
      neg.region(after, own.length());
      if (neg.lookingAt()) {
        found.total++;
        problems.add("negated comparison '" + neg.group(1) + "' on tenant column");
        continue;
      }

      Matcher set = SET_OR_PATTERN.matcher(own);
      set.region(after, own.length());
      if (set.lookingAt()) {
        found.total++;
        problems.add("'" + set.group(1).toUpperCase(Locale.ROOT).replaceAll("\\s+", " ") + "' predicate on tenant column");
      }
      // anything else (projection, GROUP BY, ORDER BY) is not a predicate
    }
    return found;
  }

  static boolean sameTenant(String literal, String tenant) {
    if (literal == null || tenant == null) return false;
    String l = literal.trim();
    String t = tenant.trim();
    if (l.isEmpty()) return false;
    if (l.equals(t)) return true;
    return isUuid(l) && isUuid(t) && l.equalsIgnoreCase(t);
  }

  private static boolean isUuid(String s) {
    if (s.length() != 36) return false;
    try {
      UUID.fromString(s);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
