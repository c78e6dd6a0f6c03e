package com.flightcatalog.airline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flightcatalog.airline.usecase.CreateAirlineCommand;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for {@code POST /api/v1/airlines}.
 *
 * <p>Code lengths are checked by the domain entity, not here.
 *
 * @param name airline name
 * @param iataCode IATA code, any case
 * @param icaoCode ICAO code, any case
 * @param country country of registration
 * @param active initial active flag, defaults to {@code true}
 */
public record AirlineCreateRequest(
    @NotBlank String name,
    @NotBlank @JsonProperty("iata_code") String iataCode,
    @NotBlank @JsonProperty("icao_code") String icaoCode,
    @NotBlank String country,
    Boolean active) {

  public CreateAirlineCommand toCommand() {
    return new CreateAirlineCommand(name, iataCode, icaoCode, country, active);
  }
}
