package com.flightcatalog.airline.domain;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable catalog entry for one airline.
 *
 * <p>Shape rules are checked on construction and both codes are stored upper-case. Code
 * uniqueness across the catalog is not checked here; see {@code CreateAirlineUseCase}.
 *
 * @param id opaque unique identifier assigned at creation
 * @param name display name
 * @param iataCode 2-character IATA airline designator
 * @param icaoCode 3 or 4 character ICAO airline designator
 * @param country country of registration
 * @param active whether the airline is currently operating
 * @param createdAt creation timestamp, {@code null} until set
 * @param updatedAt last modification timestamp, {@code null} until set
 */
public record Airline(
    String id,
    String name,
    String iataCode,
    String icaoCode,
    String country,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {

  public static final int IATA_CODE_LENGTH = 2;
  public static final int ICAO_CODE_MIN_LENGTH = 3;
  public static final int ICAO_CODE_MAX_LENGTH = 4;

  public Airline {
    if (id == null || id.isBlank()) {
      throw new AirlineValidationException("Airline id cannot be empty");
    }
    iataCode = normalizeCode(iataCode);
    icaoCode = normalizeCode(icaoCode);
    if (iataCode == null || iataCode.length() != IATA_CODE_LENGTH) {
      throw new AirlineValidationException(
          "IATA code must be exactly 2 characters, got: " + iataCode);
    }
    if (icaoCode == null
        || icaoCode.length() < ICAO_CODE_MIN_LENGTH
        || icaoCode.length() > ICAO_CODE_MAX_LENGTH) {
      throw new AirlineValidationException(
          "ICAO code must be 3 or 4 characters, got: " + icaoCode);
    }
    if (name == null || name.isBlank()) {
      throw new AirlineValidationException("Airline name cannot be empty");
    }
    if (country == null || country.isBlank()) {
      throw new AirlineValidationException("Country cannot be empty");
    }
  }

  /**
   * Upper-cases an airline code the same way the entity stores it.
   *
   * @param code raw code, may be {@code null}
   * @return upper-case code or {@code null}
   */
  public static String normalizeCode(String code) {
    return code == null ? null : code.toUpperCase(Locale.ROOT);
  }

  /**
   * Produces a new value with the patch applied and {@code updatedAt} refreshed.
   *
   * <p>Identifier, both codes and {@code createdAt} are always carried over.
   *
   * @param patch partial update, absent fields keep their current value
   * @param now timestamp recorded as {@code updatedAt}
   * @return updated copy
   */
  public Airline applyPatch(AirlinePatch patch, Instant now) {
    return new Airline(
        id,
        patch.name() != null ? patch.name() : name,
        iataCode,
        icaoCode,
        patch.country() != null ? patch.country() : country,
        patch.active() != null ? patch.active() : active,
        createdAt,
        now);
  }

  public Airline activate(Instant now) {
    return applyPatch(AirlinePatch.ofActive(true), now);
  }

  public Airline deactivate(Instant now) {
    return applyPatch(AirlinePatch.ofActive(false), now);
  }
}
