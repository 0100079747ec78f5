package com.ospicorp.kpimonitor.web;

import com.ospicorp.kpimonitor.snapshot.KpiQueryService;
import com.ospicorp.kpimonitor.snapshot.SnapshotRow;
import com.ospicorp.kpimonitor.threshold.AlertStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/snapshot")
@Tag(name = "Snapshot")
public class SnapshotController {
  private final KpiQueryService queryService;

  public SnapshotController(KpiQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping
  @Operation(summary = "Get the serving snapshot",
      description = "Latest alert status per metric and window, optionally filtered.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Snapshot rows",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = SnapshotRow.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "500", description = "Store failure",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<SnapshotRow>> snapshot(
      @RequestParam(required = false) @Parameter(description = "Section filter", example = "sales") String section,
      @RequestParam(name = "metric_key", required = false)
          @Parameter(description = "Metric key filter", example = "AcceptCount") String metricKey,
      @RequestParam(required = false) @Parameter(description = "Status filter: Green, Yellow or Red") String status,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    AlertStatus statusFilter = parseStatus(status);
    MediaType contentType = selectMediaType(format, accept);
    List<SnapshotRow> rows = queryService.snapshot(blankToNull(section), blankToNull(metricKey),
        statusFilter);
    return ResponseEntity.ok().contentType(contentType).body(rows);
  }

  private static AlertStatus parseStatus(String status) {
    if (!StringUtils.hasText(status)) return null;
    return AlertStatus.fromLabel(status).orElseThrow(() -> new InvalidParameterException(
        "Invalid status value. Supported values: Green,Yellow,Red.", 1002));
  }

  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.", 1004);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  static String blankToNull(String value) {
    return StringUtils.hasText(value) ? value.trim() : null;
  }
}
