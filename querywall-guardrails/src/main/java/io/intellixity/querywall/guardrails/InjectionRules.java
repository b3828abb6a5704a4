package io.intellixity.querywall.guardrails;

import io.intellixity.querywall.verify.ViolationCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword and pattern rules shared by the text guardrail and the plan verifier's filter-value scan.
 * <p>
 * Rules run against raw text, literals included: a denied keyword inside a value is still denied.
 */
public final class InjectionRules {

  /** A rule hit: the code and the pattern that matched. */
  public record Finding(ViolationCode code, String pattern) {}

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

  private static final Map<Pattern, ViolationCode> RULES = new LinkedHashMap<>();

  static {
    // stacked statements and writes
    rule(";", ViolationCode.INJ_001);
    rule("\\bdrop\\s+(table|database|schema|view|index|user|role)\\b", ViolationCode.INJ_001);
    rule("\\b(delete\\s+from|insert\\s+into|truncate\\s+table|alter\\s+table|create\\s+table)\\b", ViolationCode.INJ_001);
    rule("\\bupdate\\s+[\\w.\"]+\\s+set\\b", ViolationCode.INJ_001);
    rule("\\b(grant|revoke)\\s+\\w+", ViolationCode.INJ_001);
    rule("'\\s*or\\s+'?\\w+'?\\s*=\\s*'?\\w+", ViolationCode.INJ_001);

    rule("\\bunion\\b", ViolationCode.UNION_001);

    rule("--", ViolationCode.CMT_001);
    rule("/\\*", ViolationCode.CMT_001);

    rule("\\b(exec|execute|sp_executesql|xp_\\w+|pg_sleep|sleep|benchmark|pg_ls_dir|pg_stat_file|lo_import"
        + "|lo_unlink|dblink|dblink_connect|dblink_exec|system|shell|url|remote|file)\\s*\\(", ViolationCode.FUNC_001);
    rule("\\bexec(ute)?\\s+(immediate\\b|sp_|xp_|'|\")", ViolationCode.FUNC_001);

    rule("\\binto\\s+(outfile|dumpfile)\\b", ViolationCode.EXFIL_001);
    rule("\\b(load_file|pg_read_file|pg_read_binary_file|lo_export)\\s*\\(", ViolationCode.EXFIL_001);
    rule("\\bcopy\\b.*\\bto\\b", ViolationCode.EXFIL_001);
  }

  private InjectionRules() {}

  private static void rule(String regex, ViolationCode code) {
    RULES.put(Pattern.compile(regex, FLAGS), code);
  }

  /** Every distinct code whose rules match {@code text}, first matching pattern per code. */
  public static List<Finding> scan(String text) {
    List<Finding> out = new ArrayList<>();
    if (text == null || text.isEmpty()) return out;
    for (Map.Entry<Pattern, ViolationCode> e : RULES.entrySet()) {
      ViolationCode code = e.getValue();
      if (contains(out, code)) continue;
      if (e.getKey().matcher(text).find()) out.add(new Finding(code, e.getKey().pattern()));
    }
    return out;
  }

  /** Scans a filter value; collections are scanned element by element. */
  public static List<Finding> scanValue(Object value) {
    if (value == null) return List.of();
    if (value instanceof Collection<?> c) {
      List<Finding> out = new ArrayList<>();
      for (Object o : c) {
        for (Finding f : scanValue(o)) {
          if (!contains(out, f.code())) out.add(f);
        }
      }
      return out;
    }
    if (value instanceof Number || value instanceof Boolean) return List.of();
    return scan(String.valueOf(value));
  }

  private static boolean contains(List<Finding> findings, ViolationCode code) {
    for (Finding f : findings) if (f.code() == code) return true;
    return false;
  }
}
