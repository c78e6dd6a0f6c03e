package com.flightcatalog.airline.domain;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for {@link Airline} records.
 *
 * <p>No operation throws on a miss: absence is reported as an empty {@link Optional}, an
 * empty list or {@code false}.
 */
public interface AirlineRepository {
  /**
   * Finds an airline by primary key.
   *
   * @param id airline identifier
   * @return matching airline when present
   */
  Optional<Airline> findById(String id);

  /**
   * Finds the first airline carrying the given IATA code, ignoring case.
   *
   * @param iataCode IATA code, for example {@code "AA"}
   * @return matching airline when present
   */
  Optional<Airline> findByIataCode(String iataCode);

  /**
   * Finds the first airline carrying the given ICAO code, ignoring case.
   *
   * @param icaoCode ICAO code, for example {@code "AAL"}
   * @return matching airline when present
   */
  Optional<Airline> findByIcaoCode(String icaoCode);

  /**
   * Returns a snapshot of every stored airline.
   *
   * @return all airlines, order unspecified
   */
  List<Airline> findAll();

  /**
   * Returns a snapshot of the airlines flagged active.
   *
   * @return active airlines
   */
  List<Airline> findActive();

  /**
   * Inserts or replaces the airline with the same identifier.
   *
   * @param airline airline to store
   */
  void save(Airline airline);

  /**
   * Removes an airline by identifier.
   *
   * @param id airline identifier
   * @return {@code true} when a record was removed
   */
  boolean delete(String id);

  /** Removes every stored airline. */
  void clear();
}
