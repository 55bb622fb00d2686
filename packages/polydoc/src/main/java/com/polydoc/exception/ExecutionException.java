package com.polydoc.exception;

/** A command or pipeline stage failed while running. */
public class ExecutionException extends PolydocException {
  public ExecutionException(String message) {
    super(PolydocErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(PolydocErrorCode.EXECUTION_ERROR, message, cause);
  }
}
