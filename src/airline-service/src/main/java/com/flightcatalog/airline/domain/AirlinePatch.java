package com.flightcatalog.airline.domain;

/**
 * Partial update of the mutable airline fields.
 *
 * <p>{@code null} components mean "keep the current value".
 *
 * @param name replacement name
 * @param country replacement country
 * @param active replacement active flag
 */
public record AirlinePatch(String name, String country, Boolean active) {

  public static AirlinePatch ofActive(boolean active) {
    return new AirlinePatch(null, null, active);
  }
}
