package com.flightcatalog.airline;

import com.flightcatalog.airline.config.CatalogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the airline catalog service.
 *
 * <p>The application exposes CRUD endpoints over airline records under
 * {@code /api/v1/airlines} plus a {@code /health} probe.
 */
@SpringBootApplication
@EnableConfigurationProperties(CatalogProperties.class)
public class AirlineCatalogApplication {
  /**
   * Starts the airline catalog application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(AirlineCatalogApplication.class, args);
  }
}
