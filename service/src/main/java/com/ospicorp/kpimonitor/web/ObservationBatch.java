package com.ospicorp.kpimonitor.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record ObservationBatch(
    @NotNull @Size(max = 10_000) List<@Valid @NotNull ObservationRequest> observations
) {}
