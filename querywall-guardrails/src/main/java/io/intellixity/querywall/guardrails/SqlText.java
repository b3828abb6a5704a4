package io.intellixity.querywall.guardrails;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Small lexical helpers over raw query text. */
final class SqlText {
  private static final int FLAGS = Pattern.CASE_INSENSITIVE;
  private static final Pattern SUBQUERY_START = Pattern.compile("\\s*(select|with)\\b", FLAGS);
  private static final Pattern TABLE_REF = Pattern.compile("\\b(from|join)\\s+([\\w.]+)", FLAGS);
  private static final Pattern CTE_NAME = Pattern.compile("\\b(\\w+)\\s+as\\s*\\(", FLAGS);

  private SqlText() {}

  /** A parenthesised SELECT/WITH block; {@code open} is -1 for the statement itself. */
  record Scope(int open, int close) {
    boolean topLevel() {
      return open < 0;
    }

    boolean contains(Scope other) {
      return other.open > open && other.open < close;
    }
  }

  /** One FROM or JOIN target as written, schema included. */
  record TableRef(boolean join, String table) {
    /** Lower-cased table name without its schema. */
    String name() {
      String t = table.toLowerCase(Locale.ROOT);
      int dot = t.lastIndexOf('.');
      return dot >= 0 ? t.substring(dot + 1) : t;
    }
  }

  static boolean startsSubquery(String masked, int openParen) {
    return SUBQUERY_START.matcher(masked).region(openParen + 1, masked.length()).lookingAt();
  }

  /** The statement scope first, then every parenthesised SELECT/WITH block. Unclosed blocks run to the end. */
  static List<Scope> selectScopes(String masked) {
    List<Scope> out = new ArrayList<>();
    out.add(new Scope(-1, masked.length()));
    Deque<int[]> stack = new ArrayDeque<>();
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == '(') {
        stack.push(new int[] {i, startsSubquery(masked, i) ? 1 : 0});
      } else if (c == ')' && !stack.isEmpty()) {
        int[] open = stack.pop();
        if (open[1] == 1) out.add(new Scope(open[0], i));
      }
    }
    while (!stack.isEmpty()) {
      int[] open = stack.pop();
      if (open[1] == 1) out.add(new Scope(open[0], masked.length()));
    }
    return out;
  }

  /**
   * The text that belongs to {@code scope} alone, offsets kept: everything outside the scope and the
   * inside of each nested block is blanked. The nested blocks' parentheses stay.
   */
  static String ownText(String masked, Scope scope, List<Scope> all) {
    char[] out = new char[masked.length()];
    Arrays.fill(out, ' ');
    int from = Math.max(scope.open(), 0);
    int to = Math.min(scope.close(), masked.length() - 1);
    for (int i = from; i <= to; i++) out[i] = masked.charAt(i);
    for (Scope nested : all) {
      if (!scope.contains(nested)) continue;
      int end = Math.min(nested.close(), masked.length());
      for (int i = nested.open() + 1; i < end; i++) out[i] = ' ';
    }
    return new String(out);
  }

  /** Lower-cased names bound by {@code name AS (...)}. */
  static Set<String> cteNames(String masked) {
    Set<String> names = new HashSet<>();
    Matcher m = CTE_NAME.matcher(masked);
    while (m.find()) names.add(m.group(1).toLowerCase(Locale.ROOT));
    return names;
  }

  /** FROM/JOIN targets in order of appearance, skipping CTE names and FROM inside function arguments. */
  static List<TableRef> tableRefs(String masked, Set<String> cteNames) {
    List<TableRef> refs = new ArrayList<>();
    Matcher m = TABLE_REF.matcher(masked);
    while (m.find()) {
      if (!isTableReference(masked, m.start())) continue;
      TableRef ref = new TableRef(m.group(1).equalsIgnoreCase("join"), m.group(2));
      if (cteNames.contains(ref.table().toLowerCase(Locale.ROOT))) continue;
      refs.add(ref);
    }
    return refs;
  }

  /** FROM inside function arguments ({@code extract(year from ts)}, {@code is distinct from}) is not a table. */
  private static boolean isTableReference(String masked, int keywordAt) {
    if ("distinct".equals(wordBefore(masked, keywordAt))) return false;
    int paren = enclosingParen(masked, keywordAt);
    return paren < 0 || startsSubquery(masked, paren);
  }

  /**
   * Blanks out the contents of single- and double-quoted literals, keeping offsets stable.\n
   *
   * Quotes themselves are kept; doubled quotes inside a literal are treated as escapes.\n
   */
  static String maskLiterals(String sql) {
    char[] out = sql.toCharArray();
    int i = 0;
    while (i < out.length) {
      char c = out[i];
      if (c == '\'' || c == '"') {
        int j = i + 1;
        while (j < out.length) {
          if (out[j] == c) {
            if (j + 1 < out.length && out[j + 1] == c) {
              out[j] = ' ';
              out[j + 1] = ' ';
              j += 2;
              continue;
            }
            break;
          }
          out[j] = ' ';
          j++;
        }
        i = j + 1;
        continue;
      }
      i++;
    }
    return new String(out);
  }

  /** Identifier immediately before {@code idx} (skipping whitespace), lower-cased, or empty. */
  static String wordBefore(String s, int idx) {
    int end = idx;
    while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
    int start = end;
    while (start > 0 && (Character.isLetterOrDigit(s.charAt(start - 1)) || s.charAt(start - 1) == '_')) start--;
    return s.substring(start, end).toLowerCase(Locale.ROOT);
  }

  /** Offset of the innermost unmatched '(' before {@code idx}, or -1 at top level. */
  static int enclosingParen(String s, int idx) {
    int depth = 0;
    for (int i = idx - 1; i >= 0; i--) {
      char c = s.charAt(i);
      if (c == ')') depth++;
      else if (c == '(') {
        if (depth == 0) return i;
        depth--;
      }
    }
    return -1;
  }
}
