package com.flightcatalog.airline.infra;

import com.flightcatalog.airline.domain.IdGenerator;
import java.util.UUID;

/** {@link IdGenerator} backed by random (version 4) UUIDs. */
public class UuidIdGenerator implements IdGenerator {
  @Override
  public String generate() {
    return UUID.randomUUID().toString();
  }
}
