package com.ospicorp.kpimonitor.refresh;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.LocalDate;

public record RefreshSummary(
    @JsonProperty("rows_received") int rowsReceived,
    @JsonProperty("history_rows") int historyRows,
    @JsonProperty("archived_rows") int archivedRows,
    @JsonProperty("snapshot_rows") int snapshotRows,
    @JsonProperty("latest_date") LocalDate latestDate,
    @JsonProperty("refreshed_at") Instant refreshedAt
) {}
