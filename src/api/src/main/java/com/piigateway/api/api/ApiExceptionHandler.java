package com.piigateway.api.api;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for API endpoints.
 *
 * <p>Every error body has the shape {@code {"detail": "..."}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Maps request validation errors to HTTP 400.
   *
   * @param ex validation exception thrown by service logic
   * @return error payload
   */
  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
    return ResponseEntity.badRequest().body(error("Invalid request: " + ex.getMessage()));
  }

  /**
   * Maps unreadable or malformed JSON bodies to HTTP 400.
   *
   * @param ex body conversion failure
   * @return error payload
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest().body(error("Invalid request: malformed JSON body"));
  }

  /**
   * Maps an unavailable analysis engine to HTTP 503.
   *
   * @param ex engine failure
   * @return error payload
   */
  @ExceptionHandler(AnalyzerUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleUnavailable(AnalyzerUnavailableException ex) {
    log.error("Analyzer service not available", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(error("Analyzer service not available"));
  }

  /**
   * Maps unmatched routes to HTTP 404 instead of generic 500.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return error payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("Not Found"));
  }

  /**
   * Maps unsupported HTTP methods to HTTP 405.
   *
   * @param ex method mismatch
   * @return error payload
   */
  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethod(HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(error("Method Not Allowed"));
  }

  /**
   * Maps unexpected failures to HTTP 500.
   *
   * @param ex unhandled server-side exception
   * @return error payload
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unexpected error while handling request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("Internal server error occurred"));
  }

  private Map<String, Object> error(String detail) {
    return Map.of("detail", detail);
  }
}
