package com.polydoc.exception;

/** The Java compiler could not be invoked. */
public class CompilationException extends PolydocException {
  public CompilationException(String message) {
    super(PolydocErrorCode.COMPILATION_ERROR, message);
  }

  public CompilationException(String message, Throwable cause) {
    super(PolydocErrorCode.COMPILATION_ERROR, message, cause);
  }
}
