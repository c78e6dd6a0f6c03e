package com.flightcatalog.airline.usecase;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.domain.AirlineRepository;
import com.flightcatalog.airline.domain.DuplicateAirlineCodeException;
import com.flightcatalog.airline.domain.DuplicateAirlineCodeException.CodeType;
import com.flightcatalog.airline.domain.IdGenerator;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds a new airline to the catalog after checking that neither of its codes is taken.
 *
 * <p>The duplicate checks and the save run under the {@link CatalogWriteLock} shared with
 * update and delete, so no other catalog write can land between the checks and the save.
 */
public class CreateAirlineUseCase {
  private static final Logger log = LoggerFactory.getLogger(CreateAirlineUseCase.class);

  private final AirlineRepository repository;
  private final IdGenerator idGenerator;
  private final Clock clock;
  private final CatalogWriteLock writeLock;

  public CreateAirlineUseCase(
      AirlineRepository repository,
      IdGenerator idGenerator,
      Clock clock,
      CatalogWriteLock writeLock) {
    this.repository = repository;
    this.idGenerator = idGenerator;
    this.clock = clock;
    this.writeLock = writeLock;
  }

  /**
   * Creates and stores a new airline.
   *
   * @param command creation input
   * @return the stored airline
   * @throws DuplicateAirlineCodeException when the IATA or ICAO code already exists
   * @throws com.flightcatalog.airline.domain.AirlineValidationException when the input does
   *     not form a valid airline
   */
  public Airline execute(CreateAirlineCommand command) {
    String iataCode = Airline.normalizeCode(command.iataCode());
    String icaoCode = Airline.normalizeCode(command.icaoCode());

    return writeLock.withLock(() -> {
      if (iataCode != null && repository.findByIataCode(iataCode).isPresent()) {
        log.info("Rejected airline create: IATA code {} already exists", iataCode);
        throw new DuplicateAirlineCodeException(CodeType.IATA, iataCode);
      }
      if (icaoCode != null && repository.findByIcaoCode(icaoCode).isPresent()) {
        log.info("Rejected airline create: ICAO code {} already exists", icaoCode);
        throw new DuplicateAirlineCodeException(CodeType.ICAO, icaoCode);
      }

      Instant now = clock.instant();
      Airline airline = new Airline(
          idGenerator.generate(),
          command.name(),
          iataCode,
          icaoCode,
          command.country(),
          command.activeOrDefault(),
          now,
          now);

      repository.save(airline);
      log.info("Created airline id={} iata={} icao={}", airline.id(), iataCode, icaoCode);
      return airline;
    });
  }
}
