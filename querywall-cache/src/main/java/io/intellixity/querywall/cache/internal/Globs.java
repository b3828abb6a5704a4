package io.intellixity.querywall.cache.internal;

import java.util.regex.Pattern;

/** Redis-style glob patterns ({@code *}, {@code ?}, {@code [abc]}, {@code \x}) compiled to regex. */
public final class Globs {
  private Globs() {}

  public static Pattern compile(String glob) {
    StringBuilder re = new StringBuilder(glob.length() + 8);
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      switch (c) {
        case '*', '?' -> {
          flush(re, literal);
          re.append(c == '*' ? ".*" : ".");
          i++;
        }
        case '[' -> {
          int close = glob.indexOf(']', i + 1);
          if (close < 0) {
            literal.append(c);
            i++;
          } else {
            flush(re, literal);
            String body = glob.substring(i + 1, close);
            if (body.startsWith("^")) body = "^" + body.substring(1).replace("\\", "\\\\");
            else body = body.replace("\\", "\\\\");
            re.append('[').append(body).append(']');
            i = close + 1;
          }
        }
        case '\\' -> {
          if (i + 1 < glob.length()) {
            literal.append(glob.charAt(i + 1));
            i += 2;
          } else {
            literal.append(c);
            i++;
          }
        }
        default -> {
          literal.append(c);
          i++;
        }
      }
    }
    flush(re, literal);
    return Pattern.compile(re.toString(), Pattern.DOTALL);
  }

  /** Escapes glob metacharacters so {@code s} matches only itself. */
  public static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') sb.append('\\');
      sb.append(c);
    }
    return sb.toString();
  }

  private static void flush(StringBuilder re, StringBuilder literal) {
    if (literal.length() == 0) return;
    re.append(Pattern.quote(literal.toString()));
    literal.setLength(0);
  }
}
