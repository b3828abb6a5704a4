package io.intellixity.querywall.verify;

import java.util.Objects;

public record Violation(ViolationCode code, Severity severity, String message) {
  public Violation {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(severity, "severity");
    if (message == null || message.isBlank()) message = code.title();
  }

  public static Violation of(ViolationCode code, String message) {
    return new Violation(code, code.defaultSeverity(), message);
  }
}
