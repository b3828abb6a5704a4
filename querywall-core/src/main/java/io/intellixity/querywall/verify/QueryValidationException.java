package io.intellixity.querywall.verify;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a request fails the guardrail validator or the plan verifier.
 * <p>
 * Carries every violation found, not just the first, so callers can fix all issues in one revision.
 */
public final class QueryValidationException extends RuntimeException {
  private final transient VerificationResult result;

  public QueryValidationException(VerificationResult result) {
    super(describe(result));
    this.result = result;
  }

  public VerificationResult result() {
    return result;
  }

  public List<Violation> violations() {
    return result.violations();
  }

  public Severity severity() {
    return result.highestSeverity();
  }

  private static String describe(VerificationResult r) {
    if (r == null) return "Query validation failed";
    return "Query validation failed: " + r.violations().stream()
        .map(v -> v.code().name())
        .collect(Collectors.joining(", "));
  }
}
