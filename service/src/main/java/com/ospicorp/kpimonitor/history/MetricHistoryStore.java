package com.ospicorp.kpimonitor.history;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MetricHistoryStore {
  private static final Logger log = LoggerFactory.getLogger(MetricHistoryStore.class);

  static final Comparator<Observation> ORDER = Comparator
      .comparing(Observation::asOfDate, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(Observation::section)
      .thenComparing(Observation::metricKey)
      .thenComparingInt(Observation::windowDays);

  /**
   * Concatenates both lists, keeps the last row per natural key and sorts the result. Returns an
   * empty list when there is nothing incoming; callers keep their stored history in that case.
   */
  public List<Observation> append(List<Observation> existing, List<Observation> incoming) {
    if (incoming == null || incoming.isEmpty()) return List.of();
    List<Observation> all = new ArrayList<>(existing.size() + incoming.size());
    all.addAll(existing);
    all.addAll(incoming);
    return merge(all);
  }

  /** Rows kept after retention plus the number that fell before the cutoff. */
  public record Retention(List<Observation> kept, int expired) {
  }

  /**
   * Splits rows at {@code latest - (retentionDays - 1)}. Expired rows go to the archive when one
   * is given. Undated rows are dropped and not counted as expired.
   */
  public Retention retain(List<Observation> rows, int retentionDays, HistoryArchive archive) {
    if (retentionDays <= 0 || rows.isEmpty()) return new Retention(rows, 0);

    List<Observation> dated = new ArrayList<>(rows.size());
    for (Observation o : rows) {
      if (o.asOfDate() == null) {
        log.warn("Dropping history row without a date: {}/{}", o.section(), o.metricKey());
      } else {
        dated.add(o);
      }
    }
    if (dated.isEmpty()) return new Retention(dated, 0);

    LocalDate latest = dated.stream().map(Observation::asOfDate).max(Comparator.naturalOrder())
        .orElseThrow();
    LocalDate cutoff = latest.minusDays(retentionDays - 1L);
    List<Observation> kept = new ArrayList<>();
    TreeMap<YearMonth, List<Observation>> expired = new TreeMap<>();
    for (Observation o : dated) {
      if (o.asOfDate().isBefore(cutoff)) {
        expired.computeIfAbsent(YearMonth.from(o.asOfDate()), m -> new ArrayList<>()).add(o);
      } else {
        kept.add(o);
      }
    }
    int count = expired.values().stream().mapToInt(List::size).sum();
    if (count > 0) {
      if (archive != null) {
        expired.forEach(archive::merge);
        log.info("Archived {} history rows older than {} into {} monthly partitions", count,
            cutoff, expired.size());
      } else {
        log.info("Dropped {} history rows older than {} (archive disabled)", count, cutoff);
      }
    }
    return new Retention(kept, count);
  }

  public static List<Observation> merge(List<Observation> rows) {
    Map<ObservationKey, Observation> latest = new LinkedHashMap<>();
    for (Observation o : rows) {
      latest.remove(o.key());
      latest.put(o.key(), o);
    }
    List<Observation> out = new ArrayList<>(latest.values());
    out.sort(ORDER);
    return out;
  }
}
