package com.flightcatalog.airline.web;

import com.flightcatalog.airline.config.CatalogProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Logs one access line per catalog request once the response status is known. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestLoggingFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  private final CatalogProperties properties;

  public RequestLoggingFilter(CatalogProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.getRequestLogging().isEnabled()
        || !CatalogPaths.isServicePath(request.getRequestURI());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    long startNanos = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } finally {
      long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
      String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
      log.info(
          "Request: {} {} | Status: {} | Duration: {}ms | Correlation-ID: {}",
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          durationMs,
          correlationId == null ? "N/A" : correlationId);
    }
  }
}
