package com.ospicorp.kpimonitor.web;

import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.refresh.KpiRefreshService;
import com.ospicorp.kpimonitor.refresh.RefreshSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.springframework.http.ProblemDetail;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Tag(name = "Refresh")
public class ObservationController {
  private final KpiRefreshService refreshService;
  private final Clock clock;

  public ObservationController(KpiRefreshService refreshService, Clock clock) {
    this.refreshService = refreshService;
    this.clock = clock;
  }

  @PostMapping("/observations")
  @PreAuthorize("@adminAuthorization.canRefresh(authentication)")
  @Operation(summary = "Append observations",
      description = "Merges daily observations into the history, applies retention and rebuilds the snapshot.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Refresh summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = RefreshSummary.class))),
      @ApiResponse(responseCode = "400", description = "Invalid observations",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public RefreshSummary append(@Valid @RequestBody ObservationBatch batch) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    List<Observation> rows = batch.observations().stream()
        .map(r -> r.toObservation(now))
        .toList();
    return refreshService.refresh(rows);
  }

  @PostMapping("/refresh")
  @PreAuthorize("@adminAuthorization.canRefresh(authentication)")
  @Operation(summary = "Rebuild snapshot", description = "Rebuilds the serving snapshot from stored history.")
  public RefreshSummary refresh() {
    return refreshService.rebuild();
  }
}
