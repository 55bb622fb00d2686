package com.polydoc.exception;

/** I/O operation failed (filesystem, classpath, process streams). */
public class IoException extends PolydocException {
  public IoException(String message) {
    super(PolydocErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(PolydocErrorCode.IO_ERROR, message, cause);
  }
}
