package com.flightcatalog.airline.usecase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.domain.AirlinePatch;
import com.flightcatalog.airline.domain.DuplicateAirlineCodeException;
import com.flightcatalog.airline.infra.InMemoryAirlineRepository;
import com.flightcatalog.airline.support.DeterministicIdGenerator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogWriteInterleavingTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private PausingRepository repository;
  private CreateAirlineUseCase createUseCase;
  private UpdateAirlineUseCase updateUseCase;
  private DeleteAirlineUseCase deleteUseCase;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    repository = new PausingRepository();
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    CatalogWriteLock writeLock = new CatalogWriteLock();
    createUseCase =
        new CreateAirlineUseCase(repository, new DeterministicIdGenerator(), clock, writeLock);
    updateUseCase = new UpdateAirlineUseCase(repository, clock, writeLock);
    deleteUseCase = new DeleteAirlineUseCase(repository, writeLock);
    executor = Executors.newFixedThreadPool(3);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void deleteAndCreateWaitForInFlightUpdate() throws Exception {
    Airline delta = createUseCase.execute(
        new CreateAirlineCommand("Delta", "DL", "DAL", "United States", true));
    repository.pauseNextFindById();

    Future<Optional<Airline>> update =
        executor.submit(() -> updateUseCase.execute(delta.id(), AirlinePatch.ofActive(false)));
    assertThat(repository.awaitPaused()).isTrue();

    Future<Boolean> delete = executor.submit(() -> deleteUseCase.execute(delta.id()));
    Future<Airline> create = executor.submit(() -> createUseCase.execute(
        new CreateAirlineCommand("Delta Two", "DL", "DAL", "United States", true)));
    assertThatThrownBy(() -> delete.get(200, TimeUnit.MILLISECONDS))
        .isInstanceOf(TimeoutException.class);
    assertThat(create.isDone()).isFalse();

    repository.resume();

    assertThat(update.get(10, TimeUnit.SECONDS)).map(Airline::active).contains(false);
    assertThat(delete.get(10, TimeUnit.SECONDS)).isTrue();
    boolean created;
    try {
      create.get(10, TimeUnit.SECONDS);
      created = true;
    } catch (ExecutionException ex) {
      // create got the lock before delete and saw the codes still taken
      assertThat(ex.getCause()).isInstanceOf(DuplicateAirlineCodeException.class);
      created = false;
    }

    long deltaCodes = repository.findAll().stream()
        .filter(airline -> airline.iataCode().equals("DL"))
        .count();
    assertThat(deltaCodes).isEqualTo(created ? 1 : 0);
    assertThat(repository.findById(delta.id())).isEmpty();
  }

  /** Repository that can block one {@code findById} call until released. */
  private static final class PausingRepository extends InMemoryAirlineRepository {
    private final CountDownLatch paused = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);
    private volatile boolean pauseNext;

    void pauseNextFindById() {
      pauseNext = true;
    }

    boolean awaitPaused() throws InterruptedException {
      return paused.await(10, TimeUnit.SECONDS);
    }

    void resume() {
      released.countDown();
    }

    @Override
    public Optional<Airline> findById(String id) {
      Optional<Airline> result = super.findById(id);
      if (pauseNext) {
        pauseNext = false;
        paused.countDown();
        try {
          released.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
      return result;
    }
  }
}
