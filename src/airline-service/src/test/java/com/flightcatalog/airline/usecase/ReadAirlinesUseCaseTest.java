package com.flightcatalog.airline.usecase;

import static org.assertj.core.api.Assertions.assertThat;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.infra.InMemoryAirlineRepository;
import com.flightcatalog.airline.support.Airlines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReadAirlinesUseCaseTest {
  private InMemoryAirlineRepository repository;

  @BeforeEach
  void setUp() {
    repository = new InMemoryAirlineRepository();
  }

  @Test
  void getReturnsStoredAirlineOrEmpty() {
    Airline delta = Airlines.delta("id-1");
    repository.save(delta);
    GetAirlineUseCase useCase = new GetAirlineUseCase(repository);

    assertThat(useCase.execute("id-1")).contains(delta);
    assertThat(useCase.execute("id-2")).isEmpty();
  }

  @Test
  void listHonorsActiveOnlyFlag() {
    Airline delta = Airlines.delta("id-1");
    Airline lufthansa = Airlines.lufthansa("id-2", false);
    repository.save(delta);
    repository.save(lufthansa);
    ListAirlinesUseCase useCase = new ListAirlinesUseCase(repository);

    assertThat(useCase.execute(false)).containsExactlyInAnyOrder(delta, lufthansa);
    assertThat(useCase.execute(true)).containsExactly(delta);
  }

  @Test
  void listOnEmptyCatalogIsEmpty() {
    assertThat(new ListAirlinesUseCase(repository).execute(true)).isEmpty();
    assertThat(new ListAirlinesUseCase(repository).execute(false)).isEmpty();
  }
}
