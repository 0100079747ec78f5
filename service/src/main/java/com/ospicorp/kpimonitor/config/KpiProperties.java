package com.ospicorp.kpimonitor.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kpi")
public class KpiProperties {

  private Store store = new Store();
  private History history = new History();
  private Snapshot snapshot = new Snapshot();
  private Refresh refresh = new Refresh();
  private Seed seed = new Seed();

  // Threshold configuration per metric key
  private Map<String, AlertProperties> alerts = new LinkedHashMap<>();

  public Store getStore() { return store; }
  public void setStore(Store store) { this.store = store; }
  public History getHistory() { return history; }
  public void setHistory(History history) { this.history = history; }
  public Snapshot getSnapshot() { return snapshot; }
  public void setSnapshot(Snapshot snapshot) { this.snapshot = snapshot; }
  public Refresh getRefresh() { return refresh; }
  public void setRefresh(Refresh refresh) { this.refresh = refresh; }
  public Seed getSeed() { return seed; }
  public void setSeed(Seed seed) { this.seed = seed; }
  public Map<String, AlertProperties> getAlerts() { return alerts; }
  public void setAlerts(Map<String, AlertProperties> alerts) { this.alerts = alerts; }

  public static class Store {
    // csv or jdbc
    private String type = "csv";

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
  }

  public static class History {
    private String path = "data/refresh/kpi_history.csv";
    private int retentionDays = 730;
    private boolean archiveEnabled = true;
    private String archiveDir = "data/archive";

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public int getRetentionDays() { return retentionDays; }
    public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
    public boolean isArchiveEnabled() { return archiveEnabled; }
    public void setArchiveEnabled(boolean archiveEnabled) { this.archiveEnabled = archiveEnabled; }
    public String getArchiveDir() { return archiveDir; }
    public void setArchiveDir(String archiveDir) { this.archiveDir = archiveDir; }
  }

  public static class Snapshot {
    private String path = "data/refresh/kpi_serving_metrics.csv";
    private List<Integer> windows = new ArrayList<>(List.of(1, 7, 30, 60));
    // 0 means one worker per available processor
    private int parallelism = 0;

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public List<Integer> getWindows() { return windows; }
    public void setWindows(List<Integer> windows) { this.windows = windows; }
    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }
  }

  public static class Refresh {
    private boolean enabled = true;
    private String cron = "0 15 6 * * *";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getCron() { return cron; }
    public void setCron(String cron) { this.cron = cron; }
  }

  public static class Seed {
    private boolean enabled = true;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
  }

  public static class AlertProperties {
    private ThresholdProperties thresholds = new ThresholdProperties();

    public ThresholdProperties getThresholds() { return thresholds; }
    public void setThresholds(ThresholdProperties thresholds) { this.thresholds = thresholds; }
  }
}
