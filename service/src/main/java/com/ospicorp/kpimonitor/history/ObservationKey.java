package com.ospicorp.kpimonitor.history;

import java.time.LocalDate;

public record ObservationKey(LocalDate asOfDate, int windowDays, String section, String metricKey) {}
