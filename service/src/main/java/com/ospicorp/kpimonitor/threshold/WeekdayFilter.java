package com.ospicorp.kpimonitor.threshold;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WeekdayFilter {
  private static final Logger log = LoggerFactory.getLogger(WeekdayFilter.class);

  private static final Map<String, DayOfWeek> NAMES = Map.ofEntries(
      Map.entry("mon", DayOfWeek.MONDAY),
      Map.entry("monday", DayOfWeek.MONDAY),
      Map.entry("tue", DayOfWeek.TUESDAY),
      Map.entry("tues", DayOfWeek.TUESDAY),
      Map.entry("tuesday", DayOfWeek.TUESDAY),
      Map.entry("wed", DayOfWeek.WEDNESDAY),
      Map.entry("wednesday", DayOfWeek.WEDNESDAY),
      Map.entry("thu", DayOfWeek.THURSDAY),
      Map.entry("thur", DayOfWeek.THURSDAY),
      Map.entry("thurs", DayOfWeek.THURSDAY),
      Map.entry("thursday", DayOfWeek.THURSDAY),
      Map.entry("fri", DayOfWeek.FRIDAY),
      Map.entry("friday", DayOfWeek.FRIDAY),
      Map.entry("sat", DayOfWeek.SATURDAY),
      Map.entry("saturday", DayOfWeek.SATURDAY),
      Map.entry("sun", DayOfWeek.SUNDAY),
      Map.entry("sunday", DayOfWeek.SUNDAY));

  private WeekdayFilter() {
  }

  /**
   * Accepts day names and abbreviations in any case, or indices 0-6 where 0 is Monday.
   * Unrecognised tokens are logged and ignored.
   */
  public static Set<DayOfWeek> parse(Collection<String> tokens) {
    Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
    if (tokens == null) return days;
    for (String raw : tokens) {
      if (raw == null || raw.isBlank()) continue;
      String token = raw.trim().toLowerCase(Locale.ROOT);
      DayOfWeek day = NAMES.get(token);
      if (day == null) {
        day = fromIndex(token);
      }
      if (day == null) {
        log.warn("Ignoring unrecognised weekday '{}'", raw);
        continue;
      }
      days.add(day);
    }
    return days;
  }

  public static List<DataPoint> exclude(List<DataPoint> points, Set<DayOfWeek> excluded) {
    if (excluded.isEmpty()) return points;
    return points.stream()
        .filter(p -> !excluded.contains(p.date().getDayOfWeek()))
        .toList();
  }

  private static DayOfWeek fromIndex(String token) {
    try {
      int index = Integer.parseInt(token);
      return index >= 0 && index <= 6 ? DayOfWeek.of(index + 1) : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
