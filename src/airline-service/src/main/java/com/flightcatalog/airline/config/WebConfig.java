package com.flightcatalog.airline.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Opens the airline catalog routes to browser origins listed under {@code catalog.api.cors}. */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final CatalogProperties properties;

  public WebConfig(CatalogProperties properties) {
    this.properties = properties;
  }

  /**
   * Registers API CORS mappings when an allowlist is configured.
   *
   * @param registry Spring CORS registry
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> allowedOrigins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (allowedOrigins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/api/**")
        .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
        .allowedHeaders("*")
        .exposedHeaders(properties.getCorrelation().getHeaderName())
        .allowedOrigins(allowedOrigins.toArray(String[]::new))
        .maxAge(600);
  }
}
