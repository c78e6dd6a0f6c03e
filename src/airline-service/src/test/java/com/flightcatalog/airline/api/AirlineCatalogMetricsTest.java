package com.flightcatalog.airline.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flightcatalog.airline.infra.InMemoryAirlineRepository;
import com.flightcatalog.airline.support.Airlines;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AirlineCatalogMetricsTest {
  private SimpleMeterRegistry registry;
  private InMemoryAirlineRepository repository;
  private AirlineCatalogMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    repository = new InMemoryAirlineRepository();
    metrics = new AirlineCatalogMetrics(registry, repository);
  }

  @Test
  void countersIncrementPerRecordedWrite() {
    metrics.recordCreated();
    metrics.recordCreated();
    metrics.recordUpdated();
    metrics.recordDeleted();
    metrics.recordConflict();

    assertThat(registry.get("catalog.airlines.created.total").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("catalog.airlines.updated.total").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("catalog.airlines.deleted.total").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("catalog.airlines.conflicts.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void storedGaugeFollowsRepositorySize() {
    assertThat(registry.get("catalog.airlines.stored").gauge().value()).isEqualTo(0.0);

    repository.save(Airlines.delta("a-1"));
    repository.save(Airlines.american("a-2"));
    assertThat(registry.get("catalog.airlines.stored").gauge().value()).isEqualTo(2.0);

    repository.delete("a-1");
    assertThat(registry.get("catalog.airlines.stored").gauge().value()).isEqualTo(1.0);
  }
}
