package com.ospicorp.kpimonitor.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class MetricHistoryStoreTest {

  private final MetricHistoryStore store = new MetricHistoryStore();

  private static Observation row(LocalDate date, String metric, double value) {
    return new Observation(date, 1, "sales", metric, metric, value, ValueType.COUNT, "test",
        Instant.parse("2024-01-01T00:00:00Z"));
  }

  @Test
  void appendDeduplicatesByNaturalKeyAndSorts() {
    var existing = List.of(
        row(LocalDate.of(2024, 1, 2), "B", 1),
        row(LocalDate.of(2024, 1, 1), "A", 1));
    var incoming = List.of(
        row(LocalDate.of(2024, 1, 2), "B", 5),
        row(LocalDate.of(2024, 1, 1), "B", 2));

    var merged = store.append(existing, incoming);

    assertThat(merged).extracting(Observation::metricKey, Observation::value)
        .containsExactly(
            tuple("A", 1d),
            tuple("B", 2d),
            tuple("B", 5d));
  }

  @Test
  void appendIsIdempotent() {
    var existing = List.of(row(LocalDate.of(2024, 1, 1), "A", 1));
    var incoming = List.of(row(LocalDate.of(2024, 1, 2), "A", 2), row(LocalDate.of(2024, 1, 3), "A", 3));

    var once = store.append(existing, incoming);
    var twice = store.append(once, incoming);

    assertThat(twice).isEqualTo(once);
  }

  @Test
  void appendOfNothingReturnsEmpty() {
    assertThat(store.append(List.of(row(LocalDate.of(2024, 1, 1), "A", 1)), List.of())).isEmpty();
  }

  @Test
  void retentionKeepsLatestDaysAndArchivesTheRestByMonth() {
    LocalDate latest = LocalDate.of(2024, 12, 31);
    List<Observation> rows = new ArrayList<>();
    for (int i = 0; i < 800; i++) {
      rows.add(row(latest.minusDays(i), "A", i));
    }
    var archive = new InMemoryArchive();

    var retention = store.retain(rows, 730, archive);
    var kept = retention.kept();

    assertThat(kept).hasSize(730);
    assertThat(kept).extracting(Observation::asOfDate)
        .allMatch(d -> !d.isBefore(latest.minusDays(729)));
    int archived = archive.partitions.values().stream().mapToInt(List::size).sum();
    assertThat(archived).isEqualTo(70);
    assertThat(retention.expired()).isEqualTo(70);
    archive.partitions.forEach((month, partition) ->
        assertThat(partition).allMatch(o -> YearMonth.from(o.asOfDate()).equals(month)));
    assertThat(archive.partitions.firstKey()).isEqualTo(YearMonth.from(latest.minusDays(799)));
  }

  @Test
  void retentionWithoutArchiveStillTrims() {
    var rows = List.of(row(LocalDate.of(2024, 1, 1), "A", 1), row(LocalDate.of(2024, 1, 10), "A", 2));
    assertThat(store.retain(rows, 5, null).kept()).hasSize(1);
  }

  @Test
  void nonPositiveRetentionIsNoOp() {
    var rows = List.of(row(LocalDate.of(2020, 1, 1), "A", 1), row(LocalDate.of(2024, 1, 1), "A", 2));
    assertThat(store.retain(rows, 0, null).kept()).isSameAs(rows);
  }

  @Test
  void retentionDropsRowsWithoutDate() {
    var rows = List.of(row(null, "A", 1), row(LocalDate.of(2024, 1, 1), "A", 2));
    assertThat(store.retain(rows, 30, null).kept()).hasSize(1);
  }

  @Test
  void undatedRowsAreNotCountedAsExpired() {
    var rows = List.of(
        row(null, "A", 1),
        row(LocalDate.of(2024, 1, 1), "A", 2),
        row(LocalDate.of(2024, 1, 2), "A", 3),
        row(LocalDate.of(2024, 1, 10), "A", 4));

    var retention = store.retain(rows, 5, null);

    assertThat(retention.kept()).extracting(Observation::value).containsExactly(4d);
    assertThat(retention.expired()).isEqualTo(2);
  }

  @Test
  void dailyRowNormalisesDefaults() {
    var clock = Clock.fixed(Instant.parse("2024-05-01T06:15:42.123Z"), ZoneOffset.UTC);

    var row = KpiRowFactory.dailyRow(LocalDate.of(2024, 4, 30), "sales", "AcceptCount", " ", 12,
        null, null, clock);

    assertThat(row.windowDays()).isEqualTo(1);
    assertThat(row.metricLabel()).isEqualTo("AcceptCount");
    assertThat(row.valueType()).isEqualTo(ValueType.COUNT);
    assertThat(row.source()).isEqualTo(KpiRowFactory.DEFAULT_SOURCE);
    assertThat(row.refreshedAt()).isEqualTo(Instant.parse("2024-05-01T06:15:42Z"));
  }

  private static final class InMemoryArchive implements HistoryArchive {
    final TreeMap<YearMonth, List<Observation>> partitions = new TreeMap<>();

    @Override
    public void merge(YearMonth month, List<Observation> rows) {
      List<Observation> all = new ArrayList<>(partitions.getOrDefault(month, List.of()));
      all.addAll(rows);
      partitions.put(month, MetricHistoryStore.merge(all));
    }

    @Override
    public List<Observation> load(YearMonth month) {
      return partitions.getOrDefault(month, List.of());
    }
  }
}
