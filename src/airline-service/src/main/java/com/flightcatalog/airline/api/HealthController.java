package com.flightcatalog.airline.api;

import com.flightcatalog.airline.model.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness probe kept outside {@code /api} for load balancers and orchestrators. */
@RestController
public class HealthController {

  @GetMapping("/health")
  public HealthResponse health() {
    return HealthResponse.healthy();
  }
}
