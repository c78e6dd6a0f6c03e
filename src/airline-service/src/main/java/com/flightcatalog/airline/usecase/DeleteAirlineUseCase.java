package com.flightcatalog.airline.usecase;

import com.flightcatalog.airline.domain.AirlineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Removes an airline from the catalog. */
public class DeleteAirlineUseCase {
  private static final Logger log = LoggerFactory.getLogger(DeleteAirlineUseCase.class);

  private final AirlineRepository repository;
  private final CatalogWriteLock writeLock;

  public DeleteAirlineUseCase(AirlineRepository repository, CatalogWriteLock writeLock) {
    this.repository = repository;
    this.writeLock = writeLock;
  }

  /**
   * Deletes the airline with the given identifier.
   *
   * @param id airline identifier
   * @return {@code true} when an airline was removed, {@code false} when none matched
   */
  public boolean execute(String id) {
    boolean deleted = writeLock.withLock(() -> repository.delete(id));
    if (deleted) {
      log.info("Deleted airline id={}", id);
    } else {
      log.debug("Delete skipped, airline id={} not found", id);
    }
    return deleted;
  }
}
