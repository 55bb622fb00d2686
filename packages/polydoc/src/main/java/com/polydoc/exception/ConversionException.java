package com.polydoc.exception;

import java.util.Map;

/** The external document converter failed to turn markup into an AST. */
public class ConversionException extends PolydocException {
  public ConversionException(String message) {
    super(PolydocErrorCode.CONVERSION_ERROR, message);
  }

  public ConversionException(String message, Throwable cause) {
    super(PolydocErrorCode.CONVERSION_ERROR, message, cause);
  }

  public ConversionException(String message, Map<String, ?> context) {
    super(PolydocErrorCode.CONVERSION_ERROR, message, context);
  }
}
