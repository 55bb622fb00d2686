package com.polydoc.exception;

/** Component used before it was ready, or an unavailable runtime facility. */
public class StateException extends PolydocException {
  public StateException(String message) {
    super(PolydocErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(PolydocErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
