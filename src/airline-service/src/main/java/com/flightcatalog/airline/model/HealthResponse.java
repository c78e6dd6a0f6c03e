package com.flightcatalog.airline.model;

/**
 * Response contract for {@code GET /health}.
 *
 * @param status always {@code healthy} while the process serves requests
 */
public record HealthResponse(String status) {

  public static HealthResponse healthy() {
    return new HealthResponse("healthy");
  }
}
