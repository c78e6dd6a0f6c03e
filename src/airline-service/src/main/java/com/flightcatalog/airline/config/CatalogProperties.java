package com.flightcatalog.airline.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the airline catalog service.
 *
 * <p>Values are bound from {@code catalog.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {
  private final Repository repository = new Repository();
  private final Api api = new Api();
  private final Correlation correlation = new Correlation();
  private final RequestLogging requestLogging = new RequestLogging();

  public Repository getRepository() {
    return repository;
  }

  public Api getApi() {
    return api;
  }

  public Correlation getCorrelation() {
    return correlation;
  }

  public RequestLogging getRequestLogging() {
    return requestLogging;
  }

  /** Storage backend selection. Only {@code memory} is implemented. */
  public static class Repository {
    private String type = "memory";

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }
  }

  /** API-level behavior configuration. */
  public static class Api {
    private final Cors cors = new Cors();

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for browser consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** Correlation id propagation settings. */
  public static class Correlation {
    private String headerName = "X-Correlation-ID";

    public String getHeaderName() {
      return headerName;
    }

    public void setHeaderName(String headerName) {
      this.headerName = headerName;
    }
  }

  /** Per-request access logging. */
  public static class RequestLogging {
    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }
}
