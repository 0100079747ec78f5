package com.ospicorp.kpimonitor.config;

import java.util.List;

/**
 * Raw {@code kpi.alerts.<metric>.thresholds} block. Dynamic numbers are kept as text so that
 * zero or unparseable values can fall back to their defaults instead of failing startup.
 */
public class ThresholdProperties {

  private String mode = "static";
  private StaticBlock staticBounds;
  private DynamicBlock dynamic;
  private PolicyBlock policy;

  public String getMode() { return mode; }
  public void setMode(String mode) { this.mode = mode; }
  public StaticBlock getStatic() { return staticBounds; }
  public void setStatic(StaticBlock staticBounds) { this.staticBounds = staticBounds; }
  public DynamicBlock getDynamic() { return dynamic; }
  public void setDynamic(DynamicBlock dynamic) { this.dynamic = dynamic; }
  public PolicyBlock getPolicy() { return policy; }
  public void setPolicy(PolicyBlock policy) { this.policy = policy; }

  public static class StaticBlock {
    private String direction;
    private Double lowerThreshold;
    private Double upperThreshold;

    public String getDirection() { return direction; }
    public void setDirection(String direction) { this.direction = direction; }
    public Double getLowerThreshold() { return lowerThreshold; }
    public void setLowerThreshold(Double lowerThreshold) { this.lowerThreshold = lowerThreshold; }
    public Double getUpperThreshold() { return upperThreshold; }
    public void setUpperThreshold(Double upperThreshold) { this.upperThreshold = upperThreshold; }
  }

  public static class DynamicBlock {
    private String direction;
    private String k;
    private String window;
    private String zScoreLim;
    private String percentDrop;
    private String minHistoryPoints;
    private String minSeasonalPoints;
    private List<String> excludeWeekdays;
    private List<String> signalsEnabled;

    public String getDirection() { return direction; }
    public void setDirection(String direction) { this.direction = direction; }
    public String getK() { return k; }
    public void setK(String k) { this.k = k; }
    public String getWindow() { return window; }
    public void setWindow(String window) { this.window = window; }
    public String getZScoreLim() { return zScoreLim; }
    public void setZScoreLim(String zScoreLim) { this.zScoreLim = zScoreLim; }
    public String getPercentDrop() { return percentDrop; }
    public void setPercentDrop(String percentDrop) { this.percentDrop = percentDrop; }
    public String getMinHistoryPoints() { return minHistoryPoints; }
    public void setMinHistoryPoints(String minHistoryPoints) { this.minHistoryPoints = minHistoryPoints; }
    public String getMinSeasonalPoints() { return minSeasonalPoints; }
    public void setMinSeasonalPoints(String minSeasonalPoints) { this.minSeasonalPoints = minSeasonalPoints; }
    public List<String> getExcludeWeekdays() { return excludeWeekdays; }
    public void setExcludeWeekdays(List<String> excludeWeekdays) { this.excludeWeekdays = excludeWeekdays; }
    public List<String> getSignalsEnabled() { return signalsEnabled; }
    public void setSignalsEnabled(List<String> signalsEnabled) { this.signalsEnabled = signalsEnabled; }
  }

  public static class PolicyBlock {
    private Integer yellowIfSignalCountGte;
    private Integer redIfSignalCountGte;

    public Integer getYellowIfSignalCountGte() { return yellowIfSignalCountGte; }
    public void setYellowIfSignalCountGte(Integer v) { this.yellowIfSignalCountGte = v; }
    public Integer getRedIfSignalCountGte() { return redIfSignalCountGte; }
    public void setRedIfSignalCountGte(Integer v) { this.redIfSignalCountGte = v; }
  }
}
