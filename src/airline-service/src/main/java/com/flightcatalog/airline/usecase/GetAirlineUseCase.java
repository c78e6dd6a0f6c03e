package com.flightcatalog.airline.usecase;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.domain.AirlineRepository;
import java.util.Optional;

/** Looks up a single airline by identifier. */
public class GetAirlineUseCase {
  private final AirlineRepository repository;

  public GetAirlineUseCase(AirlineRepository repository) {
    this.repository = repository;
  }

  /**
   * Returns the airline with the given identifier.
   *
   * @param id airline identifier
   * @return airline when present, empty otherwise
   */
  public Optional<Airline> execute(String id) {
    return repository.findById(id);
  }
}
