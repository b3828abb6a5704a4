package io.intellixity.querywall.service.web;

import io.intellixity.querywall.cache.RateLimitExceededException;
import io.intellixity.querywall.engine.QueryExecutionException;
import io.intellixity.querywall.engine.QueryTimeoutException;
import io.intellixity.querywall.engine.TooManyRowsException;
import io.intellixity.querywall.verify.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Locale;

/** Maps the firewall's exception taxonomy onto HTTP status codes. */
@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<ErrorResponse> handleValidation(QueryValidationException ex) {
    var severity = ex.severity();
    ErrorResponse body = new ErrorResponse(
        "VALIDATION_FAILED",
        "Query failed safety validation",
        severity == null ? null : severity.name().toLowerCase(Locale.ROOT),
        ex.violations().stream().map(ErrorResponse.ViolationView::of).toList(),
        null,
        requestId());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
  }

  @ExceptionHandler(QueryTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTimeout(QueryTimeoutException ex) {
    return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
        .body(ErrorResponse.of("QUERY_TIMEOUT", ex.getMessage(), backendOf(ex), requestId()));
  }

  @ExceptionHandler(TooManyRowsException.class)
  public ResponseEntity<ErrorResponse> handleTooManyRows(TooManyRowsException ex) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(ErrorResponse.of("TOO_MANY_ROWS", ex.getMessage(), backendOf(ex), requestId()));
  }

  @ExceptionHandler(QueryExecutionException.class)
  public ResponseEntity<ErrorResponse> handleBackend(QueryExecutionException ex) {
    log.error("querywall.http op=backend_error backend={} nativeCode={}", backendOf(ex), ex.nativeCode(), ex);
    String details = ex.nativeCode() == null ? backendOf(ex) : backendOf(ex) + " code=" + ex.nativeCode();
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ErrorResponse.of("BACKEND_ERROR", "The data store could not run the query", details, requestId()));
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.retryAfter().toSeconds()))
        .body(ErrorResponse.of("RATE_LIMITED", ex.getMessage(), "limit=" + ex.limit(), requestId()));
  }

  @ExceptionHandler(ForbiddenOperationException.class)
  public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenOperationException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(ErrorResponse.of("FORBIDDEN", ex.getMessage(), null, requestId()));
  }

  @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class,
      HttpMessageNotReadableException.class})
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ErrorResponse.of("INVALID_REQUEST", ex.getMessage(), null, requestId()));
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ErrorResponse.of("NOT_FOUND", "Not found", ex.getMessage(), requestId()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleAll(Exception ex) {
    log.error("querywall.http op=unhandled", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred", null, requestId()));
  }

  private static String backendOf(QueryExecutionException ex) {
    return ex.backend() == null ? "unknown" : ex.backend().id();
  }

  private static String requestId() {
    return MDC.get(RequestIdFilter.MDC_REQUEST_ID);
  }
}
