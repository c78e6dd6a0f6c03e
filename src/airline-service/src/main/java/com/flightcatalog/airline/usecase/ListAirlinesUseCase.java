package com.flightcatalog.airline.usecase;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.domain.AirlineRepository;
import java.util.List;

/** Lists the catalog, optionally restricted to active airlines. */
public class ListAirlinesUseCase {
  private final AirlineRepository repository;

  public ListAirlinesUseCase(AirlineRepository repository) {
    this.repository = repository;
  }

  public List<Airline> execute(boolean activeOnly) {
    return activeOnly ? repository.findActive() : repository.findAll();
  }
}
