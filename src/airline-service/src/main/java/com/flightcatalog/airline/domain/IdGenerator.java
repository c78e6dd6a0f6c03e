package com.flightcatalog.airline.domain;

/** Source of unique airline identifiers. */
public interface IdGenerator {
  /**
   * Generates a new identifier.
   *
   * @return unique identifier string
   */
  String generate();
}
