package com.flightcatalog.airline.model;

import com.flightcatalog.airline.domain.AirlinePatch;
import jakarta.validation.constraints.Size;

/**
 * Request body for {@code PUT /api/v1/airlines/{id}}.
 *
 * <p>Every field is optional; omitted fields keep their stored value. Codes cannot be
 * changed through this endpoint.
 *
 * @param name replacement name
 * @param country replacement country
 * @param active replacement active flag
 */
public record AirlineUpdateRequest(
    @Size(min = 1) String name,
    @Size(min = 1) String country,
    Boolean active) {

  public AirlinePatch toPatch() {
    return new AirlinePatch(name, country, active);
  }
}
