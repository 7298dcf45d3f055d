package com.piigateway.api.api;

/**
 * Raised when the analysis engine cannot serve requests.
 *
 * <p>Mapped to HTTP 503 by {@link ApiExceptionHandler}.
 */
public class AnalyzerUnavailableException extends RuntimeException {
  public AnalyzerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
