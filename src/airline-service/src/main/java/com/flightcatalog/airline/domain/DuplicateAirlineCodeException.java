package com.flightcatalog.airline.domain;

/**
 * Raised when a new airline reuses an IATA or ICAO code already present in the catalog.
 *
 * <p>Mapped to HTTP 400 with error code {@code conflict}.
 */
public class DuplicateAirlineCodeException extends RuntimeException {
  /** Code space in which the collision happened. */
  public enum CodeType {
    IATA,
    ICAO
  }

  private final CodeType codeType;
  private final String code;

  /**
   * Creates a conflict exception naming the duplicated code.
   *
   * @param codeType code space of the duplicate
   * @param code normalized duplicated code
   */
  public DuplicateAirlineCodeException(CodeType codeType, String code) {
    super("Airline with " + codeType + " code " + code + " already exists");
    this.codeType = codeType;
    this.code = code;
  }

  public CodeType getCodeType() {
    return codeType;
  }

  public String getCode() {
    return code;
  }
}
