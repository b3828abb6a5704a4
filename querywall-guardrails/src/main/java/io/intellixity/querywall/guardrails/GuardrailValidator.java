package io.intellixity.querywall.guardrails;

import io.intellixity.querywall.ontology.InMemoryOntology;
import io.intellixity.querywall.ontology.Ontology;
import io.intellixity.querywall.plan.JoinEdge;
import io.intellixity.querywall.security.SecurityContext;
import io.intellixity.querywall.verify.VerificationResult;
import io.intellixity.querywall.verify.ViolationCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static analysis of rendered query text (SQL for the row store, analytical SQL for the columnar store).
 * <p>
 * Every check runs independently and all violations are collected; any violation makes the result
 * invalid. Severity only classifies how a violation is surfaced.
 */
public final class GuardrailValidator {
  private static final Logger log = LoggerFactory.getLogger(GuardrailValidator.class);

  private static final int FLAGS = Pattern.CASE_INSENSITIVE;
  private static final Pattern WHERE = Pattern.compile("\\bwhere\\b", FLAGS);
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
  private static final Pattern LIMIT = Pattern.compile("\\blimit\\s+(\\d+)(?:\\s*,\\s*(\\d+))?", FLAGS);
  private static final Pattern LIMIT_KEYWORD = Pattern.compile("\\blimit\\b", FLAGS);
  private static final Pattern FETCH_FIRST = Pattern.compile("\\bfetch\\s+(?:first|next)\\s+(\\d+)\\s+rows?\\b", FLAGS);
  private static final Pattern TOP = Pattern.compile("\\bselect\\s+(?:distinct\\s+)?top\\s+(\\d+)\\b", FLAGS);
  private static final Pattern ISO_DATE = Pattern.compile("(?<!\\d)(\\d{4}-\\d{2}-\\d{2})(?!\\d)");

  private final GuardrailConfig config;
  private final Ontology ontology;
  private final TenantIsolationCheck tenantCheck;

  public GuardrailValidator() {
    this(GuardrailConfig.defaults());
  }

  public GuardrailValidator(GuardrailConfig config) {
    this(config, InMemoryOntology.loadDefault());
  }

  /** The ontology supplies the PII column list and the join allow-list. */
  public GuardrailValidator(GuardrailConfig config, Ontology ontology) {
    this.config = Objects.requireNonNull(config, "config");
    this.ontology = Objects.requireNonNull(ontology, "ontology");
    this.tenantCheck = new TenantIsolationCheck(config.tenantColumn());
  }

  public GuardrailConfig config() {
    return config;
  }

  public VerificationResult validate(String queryText, SecurityContext ctx) {
    Objects.requireNonNull(ctx, "ctx");
    String sql = queryText == null ? "" : queryText;
    String masked = SqlText.maskLiterals(sql);

    VerificationResult.Builder out = VerificationResult.builder();

    tenantCheck.check(sql, ctx, out);
    for (InjectionRules.Finding f : InjectionRules.scan(sql)) {
      out.violation(f.code(), f.code().title() + " (pattern: " + f.pattern() + ")");
    }
    checkTables(masked, ctx, out);
    checkPiiColumns(masked, ctx, out);
    checkJoins(masked, ctx, out);
    checkWhere(masked, out);
    checkNesting(masked, out);
    checkLimit(masked, out);
    checkTimeWindow(sql, out);

    VerificationResult result = out.build();
    if (log.isDebugEnabled()) {
      log.debug("querywall.guardrail op=validate tenant={} role={} valid={} codes={}",
          ctx.companyId(), ctx.role(), result.valid(), result.violationCodes());
    }
    return result;
  }

  private static void checkTables(String masked, SecurityContext ctx, VerificationResult.Builder out) {
    if (ctx.bypassesRowFilter()) return;

    Set<String> rejected = new LinkedHashSet<>();
    for (SqlText.TableRef ref : SqlText.tableRefs(masked, SqlText.cteNames(masked))) {
      if (!ctx.canAccessTable(ref.table())) rejected.add(ref.table().toLowerCase(Locale.ROOT));
    }
    if (!rejected.isEmpty()) {
      out.violation(ViolationCode.TBL_001, "Table(s) not permitted for role " + ctx.role() + ": " + rejected);
    }
  }

  /** Any identifier naming a PII column, in projections, predicates or ordering alike. */
  private void checkPiiColumns(String masked, SecurityContext ctx, VerificationResult.Builder out) {
    if (ctx.bypassesRowFilter()) return;

    Set<String> found = new TreeSet<>();
    Matcher m = IDENTIFIER.matcher(masked);
    while (m.find()) {
      if (ontology.isPiiColumn(m.group())) found.add(m.group().toLowerCase(Locale.ROOT));
    }
    if (!found.isEmpty()) {
      out.violation(ViolationCode.PII_001, "PII column(s) referenced: " + found);
    }
  }

  /** Each JOIN target must have an allowed edge to a table read earlier in the same SELECT scope. */
  private void checkJoins(String masked, SecurityContext ctx, VerificationResult.Builder out) {
    if (ctx.bypassesRowFilter()) return;

    Set<String> cteNames = SqlText.cteNames(masked);
    Set<String> rejected = new LinkedHashSet<>();
    List<SqlText.Scope> scopes = SqlText.selectScopes(masked);
    for (SqlText.Scope scope : scopes) {
      List<String> read = new ArrayList<>();
      for (SqlText.TableRef ref : SqlText.tableRefs(SqlText.ownText(masked, scope, scopes), cteNames)) {
        String table = ref.name();
        if (ref.join() && !read.isEmpty()
            && read.stream().noneMatch(t -> ontology.isJoinAllowed(new JoinEdge(t, table)))) {
          rejected.add(read.get(0) + "->" + table);
        }
        read.add(table);
      }
    }
    if (!rejected.isEmpty()) {
      out.violation(ViolationCode.JOIN_001, "Join(s) not on the allow-list: " + rejected);
    }
  }

  private static void checkWhere(String masked, VerificationResult.Builder out) {
    if (!WHERE.matcher(masked).find()) {
      out.violation(ViolationCode.WHERE_001, "Query must contain a WHERE clause");
    }
  }

  private void checkNesting(String masked, VerificationResult.Builder out) {
    int depth = nestingDepth(masked);
    if (depth > config.maxNestingDepth()) {
      out.violation(ViolationCode.NEST_001,
          "Nested query depth " + depth + " exceeds limit of " + config.maxNestingDepth());
    }
  }

  /** Deepest stack of parenthesised SELECT/WITH blocks. */
  static int nestingDepth(String masked) {
    Deque<Boolean> stack = new ArrayDeque<>();
    int current = 0;
    int max = 0;
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == '(') {
        boolean subquery = SqlText.startsSubquery(masked, i);
        stack.push(subquery);
        if (subquery) max = Math.max(max, ++current);
      } else if (c == ')' && !stack.isEmpty()) {
        if (stack.pop()) current--;
      }
    }
    return max;
  }

  private void checkLimit(String masked, VerificationResult.Builder out) {
    boolean present = LIMIT_KEYWORD.matcher(masked).find();
    BigInteger max = BigInteger.valueOf(config.maxLimit());
    BigInteger largest = null;

    Matcher m = LIMIT.matcher(masked);
    while (m.find()) {
      largest = larger(largest, new BigInteger(m.group(2) != null ? m.group(2) : m.group(1)));
    }
    for (Pattern p : new Pattern[] {FETCH_FIRST, TOP}) {
      Matcher other = p.matcher(masked);
      while (other.find()) {
        present = true;
        largest = larger(largest, new BigInteger(other.group(1)));
      }
    }

    if (!present) {
      out.violation(ViolationCode.LIMIT_001, "Query must contain a LIMIT clause");
    } else if (largest != null && largest.compareTo(max) > 0) {
      out.violation(ViolationCode.LIMIT_002, "LIMIT " + largest + " exceeds maximum of " + config.maxLimit());
    }
  }

  private static BigInteger larger(BigInteger a, BigInteger b) {
    return a == null || b.compareTo(a) > 0 ? b : a;
  }

  private void checkTimeWindow(String sql, VerificationResult.Builder out) {
    LocalDate first = null;
    LocalDate last = null;
    Matcher m = ISO_DATE.matcher(sql);
    while (m.find()) {
      LocalDate d;
      try {
        d = LocalDate.parse(m.group(1));
      } catch (DateTimeParseException e) {
        continue;
      }
      if (first == null || d.isBefore(first)) first = d;
      if (last == null || d.isAfter(last)) last = d;
    }
    if (first == null) return;
    long days = ChronoUnit.DAYS.between(first, last);
    if (days > config.maxTimeWindowDays()) {
      out.violation(ViolationCode.TIME_001,
          "Time window of " + days + " days exceeds limit of " + config.maxTimeWindowDays());
    }
  }
}
