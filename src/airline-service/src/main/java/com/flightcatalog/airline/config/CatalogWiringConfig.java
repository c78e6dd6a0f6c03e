package com.flightcatalog.airline.config;

import com.flightcatalog.airline.domain.AirlineRepository;
import com.flightcatalog.airline.domain.IdGenerator;
import com.flightcatalog.airline.infra.InMemoryAirlineRepository;
import com.flightcatalog.airline.infra.UuidIdGenerator;
import com.flightcatalog.airline.usecase.CatalogWriteLock;
import com.flightcatalog.airline.usecase.CreateAirlineUseCase;
import com.flightcatalog.airline.usecase.DeleteAirlineUseCase;
import com.flightcatalog.airline.usecase.GetAirlineUseCase;
import com.flightcatalog.airline.usecase.ListAirlinesUseCase;
import com.flightcatalog.airline.usecase.UpdateAirlineUseCase;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root: builds the repository, the id generator and every use case.
 *
 * <p>Use cases are plain classes; all of them share the single repository bean created here,
 * and the writing ones share one {@link CatalogWriteLock}.
 */
@Configuration
public class CatalogWiringConfig {
  private static final Logger log = LoggerFactory.getLogger(CatalogWiringConfig.class);

  /**
   * Creates the in-memory repository, the default storage backend.
   *
   * @return empty airline repository
   */
  @Bean
  @ConditionalOnProperty(
      prefix = "catalog.repository",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  public AirlineRepository airlineRepository() {
    log.info("Using in-memory airline repository, data is not persisted across restarts");
    return new InMemoryAirlineRepository();
  }

  @Bean
  public IdGenerator idGenerator() {
    return new UuidIdGenerator();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public CatalogWriteLock catalogWriteLock() {
    return new CatalogWriteLock();
  }

  @Bean
  public CreateAirlineUseCase createAirlineUseCase(
      AirlineRepository repository,
      IdGenerator idGenerator,
      Clock clock,
      CatalogWriteLock writeLock) {
    return new CreateAirlineUseCase(repository, idGenerator, clock, writeLock);
  }

  @Bean
  public GetAirlineUseCase getAirlineUseCase(AirlineRepository repository) {
    return new GetAirlineUseCase(repository);
  }

  @Bean
  public ListAirlinesUseCase listAirlinesUseCase(AirlineRepository repository) {
    return new ListAirlinesUseCase(repository);
  }

  @Bean
  public UpdateAirlineUseCase updateAirlineUseCase(
      AirlineRepository repository, Clock clock, CatalogWriteLock writeLock) {
    return new UpdateAirlineUseCase(repository, clock, writeLock);
  }

  @Bean
  public DeleteAirlineUseCase deleteAirlineUseCase(
      AirlineRepository repository, CatalogWriteLock writeLock) {
    return new DeleteAirlineUseCase(repository, writeLock);
  }
}
