package com.flightcatalog.airline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flightcatalog.airline.domain.Airline;
import java.time.Instant;

/**
 * Response contract for a single airline.
 *
 * @param id airline identifier
 * @param name airline name
 * @param iataCode upper-case IATA code
 * @param icaoCode upper-case ICAO code
 * @param country country of registration
 * @param active active flag
 * @param createdAt ISO-8601 creation timestamp or {@code null}
 * @param updatedAt ISO-8601 modification timestamp or {@code null}
 */
public record AirlineResponse(
    String id,
    String name,
    @JsonProperty("iata_code") String iataCode,
    @JsonProperty("icao_code") String icaoCode,
    String country,
    boolean active,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt) {

  public static AirlineResponse from(Airline airline) {
    return new AirlineResponse(
        airline.id(),
        airline.name(),
        airline.iataCode(),
        airline.icaoCode(),
        airline.country(),
        airline.active(),
        isoOrNull(airline.createdAt()),
        isoOrNull(airline.updatedAt()));
  }

  private static String isoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
