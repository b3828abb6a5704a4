package io.intellixity.querywall.verify;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of the guardrail validator, the plan verifier, or both merged.\n
 *
 * A result is valid iff it carries no violation; warnings never block.\n
 */
public final class VerificationResult {
  private final List<Violation> violations;
  private final List<Violation> warnings;
  private final double estimatedCost;
  private final double estimatedTimeMs;
  private final Set<String> piiFields;

  private VerificationResult(List<Violation> violations,
                             List<Violation> warnings,
                             double estimatedCost,
                             double estimatedTimeMs,
                             Set<String> piiFields) {
    this.violations = List.copyOf(violations);
    this.warnings = List.copyOf(warnings);
    this.estimatedCost = estimatedCost;
    this.estimatedTimeMs = estimatedTimeMs;
    this.piiFields = Set.copyOf(piiFields);
  }

  public static VerificationResult passed() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean valid() { return violations.isEmpty(); }
  public List<Violation> violations() { return violations; }
  public List<Violation> warnings() { return warnings; }
  public double estimatedCost() { return estimatedCost; }
  public double estimatedTimeMs() { return estimatedTimeMs; }
  public Set<String> piiFields() { return piiFields; }
  public boolean requiresRedaction() { return !piiFields.isEmpty(); }

  public List<ViolationCode> violationCodes() {
    return violations.stream().map(Violation::code).toList();
  }

  public List<ViolationCode> warningCodes() {
    return warnings.stream().map(Violation::code).toList();
  }

  public boolean hasViolation(ViolationCode code) {
    return violations.stream().anyMatch(v -> v.code() == code);
  }

  /** Highest severity across violations, or null when valid. */
  public Severity highestSeverity() {
    Severity s = null;
    for (Violation v : violations) s = Severity.max(s, v.severity());
    return s;
  }

  /** Union of both results; cost and time take the larger estimate. */
  public VerificationResult merge(VerificationResult other) {
    if (other == null) return this;
    Builder b = new Builder();
    b.violations.addAll(violations);
    b.violations.addAll(other.violations);
    b.warnings.addAll(warnings);
    b.warnings.addAll(other.warnings);
    b.piiFields.addAll(piiFields);
    b.piiFields.addAll(other.piiFields);
    b.estimatedCost = Math.max(estimatedCost, other.estimatedCost);
    b.estimatedTimeMs = Math.max(estimatedTimeMs, other.estimatedTimeMs);
    return b.build();
  }

  @Override
  public String toString() {
    return "VerificationResult{valid=" + valid() + ", violations=" + violationCodes()
        + ", warnings=" + warningCodes() + ", estimatedCost=" + estimatedCost
        + ", estimatedTimeMs=" + estimatedTimeMs + ", piiFields=" + piiFields + "}";
  }

  public static final class Builder {
    private final List<Violation> violations = new ArrayList<>();
    private final List<Violation> warnings = new ArrayList<>();
    private final Set<String> piiFields = new LinkedHashSet<>();
    private double estimatedCost;
    private double estimatedTimeMs;

    private Builder() {}

    public Builder violation(ViolationCode code, String message) {
      violations.add(Violation.of(code, message));
      return this;
    }

    public Builder violation(Violation v) {
      violations.add(v);
      return this;
    }

    public Builder warning(ViolationCode code, String message) {
      warnings.add(new Violation(code, Severity.WARNING, message));
      return this;
    }

    public Builder piiFields(Collection<String> fields) {
      if (fields != null) piiFields.addAll(fields);
      return this;
    }

    public Builder estimatedCost(double cost) {
      this.estimatedCost = cost;
      return this;
    }

    public Builder estimatedTimeMs(double timeMs) {
      this.estimatedTimeMs = timeMs;
      return this;
    }

    public boolean hasViolations() {
      return !violations.isEmpty();
    }

    public VerificationResult build() {
      return new VerificationResult(violations, warnings, estimatedCost, estimatedTimeMs, piiFields);
    }
  }
}
