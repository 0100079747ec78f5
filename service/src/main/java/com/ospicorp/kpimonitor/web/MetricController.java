package com.ospicorp.kpimonitor.web;

import com.ospicorp.kpimonitor.snapshot.KpiQueryService;
import com.ospicorp.kpimonitor.snapshot.SnapshotRow;
import com.ospicorp.kpimonitor.threshold.MetricSeries;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/metrics/{section}/{metricKey}")
@Tag(name = "Metrics")
public class MetricController {
  static final int MAX_WINDOW_DAYS = 3660;

  private final KpiQueryService queryService;

  public MetricController(KpiQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping("/history")
  @Operation(summary = "Get daily history", description = "Daily series of one metric, optionally limited to a date range.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Daily series",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = MetricSeries.class))),
      @ApiResponse(responseCode = "404", description = "Unknown metric",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public MetricSeries history(
      @PathVariable @Parameter(description = "Section", example = "sales") String section,
      @PathVariable @Parameter(description = "Metric key", example = "AcceptCount") String metricKey,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          @Parameter(description = "Start date (inclusive)") LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          @Parameter(description = "End date (inclusive)") LocalDate end) {
    if (start != null && end != null && start.isAfter(end)) {
      throw new InvalidParameterException("Invalid date range: start must not be after end.", 1003);
    }
    return queryService.history(section, metricKey, start, end);
  }

  @GetMapping("/evaluation")
  @Operation(summary = "Evaluate one window",
      description = "Aggregate and threshold evaluation of the latest window, computed on demand.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Evaluation",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SnapshotRow.class))),
      @ApiResponse(responseCode = "400", description = "Invalid window",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "Unknown metric",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SnapshotRow evaluation(
      @PathVariable String section,
      @PathVariable String metricKey,
      @RequestParam(defaultValue = "1") @Parameter(description = "Window in days", example = "7") int window) {
    if (window < 1 || window > MAX_WINDOW_DAYS) {
      throw new InvalidParameterException(
          "Invalid window parameter. Supported range: 1-" + MAX_WINDOW_DAYS + ".", 1001);
    }
    return queryService.evaluate(section, metricKey, window);
  }
}
