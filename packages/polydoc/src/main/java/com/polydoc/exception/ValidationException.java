package com.polydoc.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends PolydocException {
  public ValidationException(String message) {
    super(PolydocErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(PolydocErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
