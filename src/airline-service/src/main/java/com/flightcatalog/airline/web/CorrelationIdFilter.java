package com.flightcatalog.airline.web;

import com.flightcatalog.airline.config.CatalogProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter propagating a correlation id through logs and responses.
 *
 * <p>The id is taken from the configured request header or generated, stored in the SLF4J
 * MDC under {@value #MDC_KEY} for the duration of the request and echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {
  public static final String MDC_KEY = "correlationId";

  private final CatalogProperties properties;

  public CorrelationIdFilter(CatalogProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !CatalogPaths.isServicePath(request.getRequestURI());
  }

  /**
   * Resolves the correlation id and exposes it to downstream logging.
   *
   * @param request current HTTP request
   * @param response current HTTP response
   * @param filterChain downstream filter chain
   * @throws ServletException if servlet processing fails
   * @throws IOException if response writing fails
   */
  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    String headerName = properties.getCorrelation().getHeaderName();
    String correlationId = request.getHeader(headerName);
    if (correlationId == null || correlationId.isBlank()) {
      correlationId = UUID.randomUUID().toString();
    }

    MDC.put(MDC_KEY, correlationId);
    response.setHeader(headerName, correlationId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_KEY);
    }
  }
}
