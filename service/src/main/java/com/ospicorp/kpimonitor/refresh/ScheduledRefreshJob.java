package com.ospicorp.kpimonitor.refresh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "kpi.refresh.enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledRefreshJob {
  private static final Logger log = LoggerFactory.getLogger(ScheduledRefreshJob.class);

  private final KpiRefreshService refreshService;

  public ScheduledRefreshJob(KpiRefreshService refreshService) {
    this.refreshService = refreshService;
  }

  @Scheduled(cron = "${kpi.refresh.cron:0 15 6 * * *}")
  public void rebuildSnapshot() {
    log.info("Starting scheduled snapshot rebuild");
    try {
      RefreshSummary summary = refreshService.rebuild();
      log.info("Scheduled snapshot rebuild finished with {} rows as of {}",
          summary.snapshotRows(), summary.latestDate());
    } catch (RuntimeException ex) {
      log.error("Scheduled snapshot rebuild failed", ex);
    }
  }
}
