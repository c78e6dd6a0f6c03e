package com.flightcatalog.airline.domain;

/**
 * Raised when an {@link Airline} would violate its shape rules.
 *
 * <p>Mapped to HTTP 400 with error code {@code validation_error}.
 */
public class AirlineValidationException extends RuntimeException {
  /**
   * Creates a validation exception with a client-facing message.
   *
   * @param message description of the violated rule
   */
  public AirlineValidationException(String message) {
    super(message);
  }
}
