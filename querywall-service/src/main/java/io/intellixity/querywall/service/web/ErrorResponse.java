package io.intellixity.querywall.service.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.querywall.verify.Violation;

import java.util.List;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String code,
                            String message,
                            String severity,
                            List<ViolationView> violations,
                            String details,
                            String requestId) {

  public record ViolationView(String code, String severity, String message) {
    static ViolationView of(Violation v) {
      return new ViolationView(v.code().name(), v.severity().name().toLowerCase(Locale.ROOT), v.message());
    }
  }

  public static ErrorResponse of(String code, String message, String details, String requestId) {
    return new ErrorResponse(code, message, null, null, details, requestId);
  }
}
