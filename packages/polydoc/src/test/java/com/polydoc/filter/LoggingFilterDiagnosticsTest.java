package com.polydoc.filter;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.polydoc.exception.ConversionException;
import com.polydoc.exception.PolydocErrorCode;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoggingFilterDiagnostics")
class LoggingFilterDiagnosticsTest {

  @Mock private Logger logger;

  @Test
  @DisplayName("a failure is written as one ERROR line carrying code, context and stack trace")
  void reportsPolydocFailure() {
    ConversionException error = new ConversionException("Pandoc failed", Map.of("exitCode", 2));

    new LoggingFilterDiagnostics(logger).report("include", error);

    verify(logger)
        .error(
            anyString(),
            eq("include"),
            eq("ConversionException"),
            eq(PolydocErrorCode.CONVERSION_ERROR),
            eq("Pandoc failed"),
            eq(" {exitCode=2}"),
            same(error));
    verifyNoMoreInteractions(logger);
  }

  @Test
  @DisplayName("other exceptions are logged with the UNKNOWN code and no context")
  void reportsPlainRuntimeException() {
    IllegalStateException error = new IllegalStateException("bad state");

    new LoggingFilterDiagnostics(logger).report("java-exec", error);

    verify(logger)
        .error(
            anyString(),
            eq("java-exec"),
            eq("IllegalStateException"),
            eq(PolydocErrorCode.UNKNOWN),
            eq("bad state"),
            eq(""),
            same(error));
    verifyNoMoreInteractions(logger);
  }
}
