package com.polydoc.exception;

/**
 * Canonical error codes for Polydoc. Codes are stable and suitable for logs and diagnostics. Prefer
 * choosing the most specific code that reflects the failure origin.
 */
public enum PolydocErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  CONVERSION_ERROR,
  COMPILATION_ERROR,
  EXECUTION_ERROR,
}
