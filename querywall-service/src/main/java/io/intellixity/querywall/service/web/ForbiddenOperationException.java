package io.intellixity.querywall.service.web;

/** The caller's role may not perform the requested administrative operation. */
public final class ForbiddenOperationException extends RuntimeException {
  public ForbiddenOperationException(String message) {
    super(message);
  }
}
