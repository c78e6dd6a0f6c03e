package com.flightcatalog.airline.usecase;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.domain.AirlinePatch;
import com.flightcatalog.airline.domain.AirlineRepository;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a partial update to an existing airline.
 *
 * <p>Only name, country and the active flag can change; codes are fixed at creation. The
 * read-patch-save sequence holds the {@link CatalogWriteLock}, so a concurrent delete cannot
 * be undone by a stale save.
 */
public class UpdateAirlineUseCase {
  private static final Logger log = LoggerFactory.getLogger(UpdateAirlineUseCase.class);

  private final AirlineRepository repository;
  private final Clock clock;
  private final CatalogWriteLock writeLock;

  public UpdateAirlineUseCase(
      AirlineRepository repository, Clock clock, CatalogWriteLock writeLock) {
    this.repository = repository;
    this.clock = clock;
    this.writeLock = writeLock;
  }

  /**
   * Updates the airline with the given identifier.
   *
   * @param id airline identifier
   * @param patch fields to replace
   * @return updated airline, or empty when no airline has this identifier
   * @throws com.flightcatalog.airline.domain.AirlineValidationException when the patch
   *     would make the airline invalid
   */
  public Optional<Airline> execute(String id, AirlinePatch patch) {
    return writeLock.withLock(() -> patchAndSave(id, patch));
  }

  private Optional<Airline> patchAndSave(String id, AirlinePatch patch) {
    Optional<Airline> existing = repository.findById(id);
    if (existing.isEmpty()) {
      log.debug("Update skipped, airline id={} not found", id);
      return Optional.empty();
    }

    Airline updated = existing.get().applyPatch(patch, clock.instant());
    repository.save(updated);
    log.info("Updated airline id={} active={}", updated.id(), updated.active());
    return Optional.of(updated);
  }
}
