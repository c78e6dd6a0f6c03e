package com.flightcatalog.airline.usecase;

/**
 * Input of {@link CreateAirlineUseCase}.
 *
 * @param name airline name
 * @param iataCode IATA code in any case
 * @param icaoCode ICAO code in any case
 * @param country country of registration
 * @param active initial active flag, {@code null} means active
 */
public record CreateAirlineCommand(
    String name, String iataCode, String icaoCode, String country, Boolean active) {

  public boolean activeOrDefault() {
    return active == null || active;
  }
}
