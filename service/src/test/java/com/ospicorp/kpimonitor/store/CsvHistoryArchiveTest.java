package com.ospicorp.kpimonitor.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvHistoryArchiveTest {

  @TempDir
  Path dir;

  private static Observation row(int day, double value) {
    return new Observation(LocalDate.of(2023, 3, day), 1, "sales", "AcceptCount", "Accepted",
        value, ValueType.COUNT, "daily_refresh", null);
  }

  @Test
  void mergeWritesMonthlyPartitionAndKeepsLatestDuplicate() {
    var archive = new CsvHistoryArchive(dir);
    YearMonth march = YearMonth.of(2023, 3);

    archive.merge(march, List.of(row(1, 10), row(2, 20)));
    archive.merge(march, List.of(row(2, 25), row(3, 30)));

    assertThat(dir.resolve("kpi_history_2023_03.csv")).exists();
    assertThat(archive.load(march)).extracting(Observation::value).containsExactly(10d, 25d, 30d);
    assertThat(archive.load(YearMonth.of(2023, 4))).isEmpty();
  }
}
