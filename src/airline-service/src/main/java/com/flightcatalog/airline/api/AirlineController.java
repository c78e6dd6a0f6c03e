package com.flightcatalog.airline.api;

import com.flightcatalog.airline.domain.Airline;
import com.flightcatalog.airline.model.AirlineCreateRequest;
import com.flightcatalog.airline.model.AirlineResponse;
import com.flightcatalog.airline.model.AirlineUpdateRequest;
import com.flightcatalog.airline.usecase.CreateAirlineUseCase;
import com.flightcatalog.airline.usecase.DeleteAirlineUseCase;
import com.flightcatalog.airline.usecase.GetAirlineUseCase;
import com.flightcatalog.airline.usecase.ListAirlinesUseCase;
import com.flightcatalog.airline.usecase.UpdateAirlineUseCase;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing CRUD endpoints for the airline catalog.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code POST /api/v1/airlines}: create, 201 or 400 on duplicate code</li>
 *   <li>{@code GET /api/v1/airlines?active_only=}: list</li>
 *   <li>{@code GET /api/v1/airlines/{id}}: detail, 404 when absent</li>
 *   <li>{@code PUT /api/v1/airlines/{id}}: partial update, 404 when absent</li>
 *   <li>{@code DELETE /api/v1/airlines/{id}}: 204, 404 when absent</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/airlines")
public class AirlineController {
  private final CreateAirlineUseCase createAirline;
  private final GetAirlineUseCase getAirline;
  private final ListAirlinesUseCase listAirlines;
  private final UpdateAirlineUseCase updateAirline;
  private final DeleteAirlineUseCase deleteAirline;
  private final AirlineCatalogMetrics metrics;

  public AirlineController(
      CreateAirlineUseCase createAirline,
      GetAirlineUseCase getAirline,
      ListAirlinesUseCase listAirlines,
      UpdateAirlineUseCase updateAirline,
      DeleteAirlineUseCase deleteAirline,
      AirlineCatalogMetrics metrics) {
    this.createAirline = createAirline;
    this.getAirline = getAirline;
    this.listAirlines = listAirlines;
    this.updateAirline = updateAirline;
    this.deleteAirline = deleteAirline;
    this.metrics = metrics;
  }

  /**
   * Creates a new airline.
   *
   * @param request creation payload
   * @return created airline with HTTP 201
   */
  @PostMapping({"", "/"})
  public ResponseEntity<AirlineResponse> create(@Valid @RequestBody AirlineCreateRequest request) {
    Airline created = createAirline.execute(request.toCommand());
    metrics.recordCreated();
    return ResponseEntity.status(HttpStatus.CREATED).body(AirlineResponse.from(created));
  }

  /**
   * Lists airlines.
   *
   * @param activeOnly when {@code true}, only active airlines are returned
   * @return matching airlines
   */
  @GetMapping({"", "/"})
  public List<AirlineResponse> list(
      @RequestParam(value = "active_only", defaultValue = "false") boolean activeOnly) {
    return listAirlines.execute(activeOnly).stream().map(AirlineResponse::from).toList();
  }

  @GetMapping("/{id}")
  public AirlineResponse get(@PathVariable("id") String id) {
    return getAirline.execute(id)
        .map(AirlineResponse::from)
        .orElseThrow(() -> airlineNotFound(id));
  }

  /**
   * Applies a partial update.
   *
   * @param id airline identifier
   * @param request fields to replace
   * @return updated airline
   */
  @PutMapping("/{id}")
  public AirlineResponse update(
      @PathVariable("id") String id, @Valid @RequestBody AirlineUpdateRequest request) {
    AirlineResponse response = updateAirline.execute(id, request.toPatch())
        .map(AirlineResponse::from)
        .orElseThrow(() -> airlineNotFound(id));
    metrics.recordUpdated();
    return response;
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    if (!deleteAirline.execute(id)) {
      throw airlineNotFound(id);
    }
    metrics.recordDeleted();
    return ResponseEntity.noContent().build();
  }

  private static NotFoundException airlineNotFound(String id) {
    return new NotFoundException("Airline not found: " + id);
  }
}
