package com.ospicorp.kpimonitor.web;

import com.ospicorp.kpimonitor.config.KpiProperties;
import com.ospicorp.kpimonitor.threshold.ThresholdConfigRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {
  private final KpiProperties properties;
  private final ThresholdConfigRegistry registry;

  public RootController(KpiProperties properties, ThresholdConfigRegistry registry) {
    this.properties = properties;
    this.registry = registry;
  }

  // Service descriptor: active store, snapshot windows and metrics with alert config
  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "kpi-monitor");
    body.put("status", "ok");
    body.put("store", properties.getStore().getType());
    body.put("windows", properties.getSnapshot().getWindows());
    body.put("configured_metrics", registry.configuredMetrics());
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
