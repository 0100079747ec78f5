package com.ospicorp.kpimonitor.threshold;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.time.LocalDate;

// One daily (or rolled-up) value of a metric series
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
public record DataPoint(LocalDate date, double value) {}
