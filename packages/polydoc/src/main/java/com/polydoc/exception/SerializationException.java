package com.polydoc.exception;

/** JSON or YAML could not be read or written. */
public class SerializationException extends PolydocException {
  public SerializationException(String message) {
    super(PolydocErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(PolydocErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
