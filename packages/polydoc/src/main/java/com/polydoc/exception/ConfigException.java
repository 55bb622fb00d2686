package com.polydoc.exception;

/** Configuration could not be loaded or holds an invalid value. */
public class ConfigException extends PolydocException {
  public ConfigException(String message) {
    super(PolydocErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(PolydocErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
