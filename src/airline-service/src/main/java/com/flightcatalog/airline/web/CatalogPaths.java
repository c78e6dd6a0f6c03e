package com.flightcatalog.airline.web;

/** Path predicates shared by the catalog servlet filters. */
final class CatalogPaths {
  private CatalogPaths() {}

  static boolean isServicePath(String path) {
    return path != null && (path.startsWith("/api/") || path.equals("/health"));
  }
}
