package com.flightcatalog.airline;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.flightcatalog.airline.domain.AirlineRepository;
import com.flightcatalog.airline.infra.InMemoryAirlineRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class AirlineCatalogApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Autowired
  private AirlineRepository airlineRepository;

  @Test
  void contextLoads() {
    assertNotNull(applicationContext);
    assertInstanceOf(InMemoryAirlineRepository.class, airlineRepository);
  }
}
