package com.polydoc.filter;

import com.polydoc.exception.ErrorDetails;
import com.polydoc.exception.ExceptionUtil;
import java.util.Objects;

/** Reports filter failures, message and stack trace, to an SLF4J logger at ERROR level. */
public class LoggingFilterDiagnostics implements FilterDiagnostics {
  private final org.slf4j.Logger log;

  public LoggingFilterDiagnostics() {
    this(com.polydoc.logging.LoggingService.getLogger(SafeFilter.class));
  }

  public LoggingFilterDiagnostics(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void report(String filterName, Throwable error) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(error);
    log.error(
        "Filter '{}' failed and was skipped, document left unchanged [{} {}]: {}{}",
        filterName,
        details.type(),
        details.code(),
        details.message(),
        details.contextSuffix(),
        error);
  }
}
