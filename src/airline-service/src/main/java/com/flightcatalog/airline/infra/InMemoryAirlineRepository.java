package com.flightcatalog.airline.infra;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.domain.AirlineRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Thread-safe in-memory implementation of {@link AirlineRepository}.
 *
 * <p>Every operation, reads included, runs under one exclusive lock so code scans never
 * observe the map while another thread mutates it. Data is lost on restart.
 */
public class InMemoryAirlineRepository implements AirlineRepository {
  private final Map<String, Airline> airlines = new LinkedHashMap<>();
  private final Object lock = new Object();

  @Override
  public Optional<Airline> findById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    synchronized (lock) {
      return Optional.ofNullable(airlines.get(id));
    }
  }

  @Override
  public Optional<Airline> findByIataCode(String iataCode) {
    return findFirstByCode(iataCode, Airline::iataCode);
  }

  @Override
  public Optional<Airline> findByIcaoCode(String icaoCode) {
    return findFirstByCode(icaoCode, Airline::icaoCode);
  }

  @Override
  public List<Airline> findAll() {
    synchronized (lock) {
      return List.copyOf(airlines.values());
    }
  }

  @Override
  public List<Airline> findActive() {
    synchronized (lock) {
      return airlines.values().stream().filter(Airline::active).toList();
    }
  }

  @Override
  public void save(Airline airline) {
    synchronized (lock) {
      airlines.put(airline.id(), airline);
    }
  }

  @Override
  public boolean delete(String id) {
    if (id == null) {
      return false;
    }
    synchronized (lock) {
      return airlines.remove(id) != null;
    }
  }

  @Override
  public void clear() {
    synchronized (lock) {
      airlines.clear();
    }
  }

  private Optional<Airline> findFirstByCode(String code, Function<Airline, String> codeOf) {
    String normalized = Airline.normalizeCode(code);
    if (normalized == null || normalized.isBlank()) {
      return Optional.empty();
    }
    synchronized (lock) {
      for (Airline airline : airlines.values()) {
        if (normalized.equals(codeOf.apply(airline))) {
          return Optional.of(airline);
        }
      }
      return Optional.empty();
    }
  }
}
