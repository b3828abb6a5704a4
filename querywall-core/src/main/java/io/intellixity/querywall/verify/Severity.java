package io.intellixity.querywall.verify;

/**
 * How a finding should be surfaced and alerted on.
 * <p>
 * Severity never decides whether a request runs: every violation blocks execution.
 */
public enum Severity {
  WARNING,
  MEDIUM,
  HIGH,
  CRITICAL;

  public boolean atLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  public static Severity max(Severity a, Severity b) {
    if (a == null) return b;
    if (b == null) return a;
    return a.compareTo(b) >= 0 ? a : b;
  }
}
