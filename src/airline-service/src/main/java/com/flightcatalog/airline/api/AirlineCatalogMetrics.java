package com.flightcatalog.airline.api;

import com.flightcatalog.airline.domain.AirlineRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/** Micrometer meters describing catalog write activity and size. */
@Component
public class AirlineCatalogMetrics {
  private final Counter createdCounter;
  private final Counter updatedCounter;
  private final Counter deletedCounter;
  private final Counter conflictCounter;

  public AirlineCatalogMetrics(MeterRegistry meterRegistry, AirlineRepository repository) {
    this.createdCounter = meterRegistry.counter("catalog.airlines.created.total");
    this.updatedCounter = meterRegistry.counter("catalog.airlines.updated.total");
    this.deletedCounter = meterRegistry.counter("catalog.airlines.deleted.total");
    this.conflictCounter = meterRegistry.counter("catalog.airlines.conflicts.total");
    meterRegistry.gauge("catalog.airlines.stored", repository, repo -> repo.findAll().size());
  }

  public void recordCreated() {
    createdCounter.increment();
  }

  public void recordUpdated() {
    updatedCounter.increment();
  }

  public void recordDeleted() {
    deletedCounter.increment();
  }

  public void recordConflict() {
    conflictCounter.increment();
  }
}
