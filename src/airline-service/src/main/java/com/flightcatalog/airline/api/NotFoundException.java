package com.flightcatalog.airline.api;

/**
 * API-level exception used when a requested airline does not exist.
 *
 * <p>Use cases report absence as data; only the controller turns it into this exception,
 * which {@link ApiExceptionHandler} maps to HTTP 404.
 */
public class NotFoundException extends RuntimeException {
  /**
   * Creates a not-found exception with a client-facing message.
   *
   * @param message missing-resource description
   */
  public NotFoundException(String message) {
    super(message);
  }
}
