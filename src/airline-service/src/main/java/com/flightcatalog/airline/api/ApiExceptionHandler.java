package com.flightcatalog.airline.api;

import com.flightcatalog.airline.domain.AirlineValidationException;
import com.flightcatalog.airline.domain.DuplicateAirlineCodeException;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for catalog API endpoints.
 *
 * <p>Domain and request exceptions are converted into stable JSON error payloads. Duplicate
 * codes and invalid shapes both answer HTTP 400 but carry distinct error codes.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final AirlineCatalogMetrics metrics;

  public ApiExceptionHandler(AirlineCatalogMetrics metrics) {
    this.metrics = metrics;
  }

  /**
   * Maps duplicate IATA/ICAO codes to HTTP 400.
   *
   * @param ex conflict raised by the create use case
   * @return standardized error payload
   */
  @ExceptionHandler(DuplicateAirlineCodeException.class)
  public ResponseEntity<Map<String, Object>> handleConflict(DuplicateAirlineCodeException ex) {
    metrics.recordConflict();
    return ResponseEntity.badRequest().body(error("conflict", ex.getMessage()));
  }

  /**
   * Maps entity shape violations to HTTP 400.
   *
   * @param ex validation failure raised while building an airline
   * @return standardized error payload
   */
  @ExceptionHandler(AirlineValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(AirlineValidationException ex) {
    return ResponseEntity.badRequest().body(error("validation_error", ex.getMessage()));
  }

  /**
   * Maps bean validation failures on request bodies to HTTP 400.
   *
   * @param ex binding result of the rejected body
   * @return standardized error payload listing the rejected fields
   */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
    String message = ex.getBindingResult().getFieldErrors().stream()
        .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
        .sorted()
        .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest().body(error("validation_error", message));
  }

  /**
   * Maps unreadable bodies and mistyped parameters to HTTP 400.
   *
   * @param ex parsing or conversion failure
   * @return standardized error payload
   */
  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
    return ResponseEntity.badRequest().body(error("bad_request", "malformed request"));
  }

  /**
   * Maps request bodies in an unsupported content type to HTTP 415.
   *
   * @param ex content type rejected by message conversion
   * @return standardized error payload
   */
  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleUnsupportedMediaType(
      HttpMediaTypeNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
        .body(error("bad_request", "unsupported content type: " + ex.getContentType()));
  }

  /**
   * Maps verbs a route does not accept to HTTP 405.
   *
   * @param ex method rejected by handler mapping
   * @return standardized error payload
   */
  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(
      HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .body(error("bad_request", "method not allowed: " + ex.getMethod()));
  }

  /**
   * Maps resource-not-found conditions to HTTP 404.
   *
   * @param ex missing-resource exception
   * @return standardized error payload
   */
  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
  }

  /**
   * Maps unmatched routes to HTTP 404 instead of generic 500.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return standardized not-found payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found", "resource not found"));
  }

  /**
   * Maps unexpected failures to HTTP 500.
   *
   * @param ex unhandled server-side exception
   * @return standardized error payload
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    return Map.of(
        "error", code,
        "message", message,
        "timestamp", Instant.now().toString());
  }
}
