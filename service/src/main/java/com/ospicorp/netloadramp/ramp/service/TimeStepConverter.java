package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.SimulationOptions;
import com.ospicorp.netloadramp.ramp.model.TableAttributes;
import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.Aggregation;
import com.ospicorp.netloadramp.ramp.model.enums.TimeStep;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-aggregates hourly tables into daily, weekly, monthly or annual ones, with one statistic
 * per value column.
 */
public final class TimeStepConverter {
  static final String TIME = "time";
  static final String ANNUAL_LABEL = "Annual";

  private TimeStepConverter() {
  }

  /**
   * Resamples {@code table} to {@code to}. {@code funs} is aligned with the value columns of
   * the table; a single statistic applies to every column. Calendar buckets come from the
   * simulation options attached to the table.
   */
  public static TimeSeriesTable changeTimeStep(TimeSeriesTable table, TimeStep to,
      List<Aggregation> funs) {
    TableAttributes attributes = table.attributes();
    TimeStep from = attributes != null && attributes.timeStep() != null
        ? attributes.timeStep()
        : TimeStep.HOURLY;
    if (to == from) return table;
    if (from != TimeStep.HOURLY) {
      throw new IllegalArgumentException(
          "Cannot change time step from " + from.code() + " to " + to.code());
    }
    List<String> columns = table.valueColumns();
    if (funs.size() != 1 && funs.size() != columns.size()) {
      throw new IllegalArgumentException("Got " + funs.size() + " aggregation functions for "
          + columns.size() + " columns");
    }
    SimulationOptions options = attributes != null ? attributes.options() : null;
    if (to != TimeStep.ANNUAL && (options == null || options.start() == null)) {
      throw new IllegalStateException(
          "Simulation start date is required to build " + to.code() + " time steps");
    }

    List<String> entity = table.entityColumns();
    Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
    for (int i = 0; i < table.rowCount(); i++) {
      List<Object> key = table.key(i, entity);
      Object timeId = table.id(TimeSeriesTable.TIME_ID, i);
      if (!(timeId instanceof Number hour)) {
        throw new IllegalArgumentException("Non numeric timeId: " + timeId);
      }
      Bucket bucket = bucket(hour.longValue(), to, options);
      key.add(bucket.index());
      key.add(bucket.label());
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
    }

    List<String> idColumns = new ArrayList<>(entity);
    idColumns.add(TimeSeriesTable.TIME_ID);
    idColumns.add(TIME);
    Map<String, List<Object>> ids = new LinkedHashMap<>();
    idColumns.forEach(c -> ids.put(c, new ArrayList<>(groups.size())));
    for (List<Object> key : groups.keySet()) {
      for (int k = 0; k < idColumns.size(); k++) {
        ids.get(idColumns.get(k)).add(key.get(k));
      }
    }

    Map<String, double[]> values = new LinkedHashMap<>();
    for (int c = 0; c < columns.size(); c++) {
      Aggregation fun = funs.size() == 1 ? funs.get(0) : funs.get(c);
      double[] cells = table.column(columns.get(c));
      double[] out = new double[groups.size()];
      int g = 0;
      for (List<Integer> rows : groups.values()) {
        double[] members = new double[rows.size()];
        for (int i = 0; i < members.length; i++) {
          members[i] = cells[rows.get(i)];
        }
        out[g++] = fun.apply(members, 0, members.length);
      }
      values.put(columns.get(c), out);
    }

    return TimeSeriesTable.of(idColumns, ids, values, attributes != null
            ? attributes.withTimeStep(to)
            : new TableAttributes(null, to, false, null))
        .sortedBy(idColumns);
  }

  static Bucket bucket(long timeId, TimeStep to, SimulationOptions options) {
    long day = (timeId - 1) / 24 + 1;
    return switch (to) {
      case DAILY -> new Bucket(day, dateOf(options, day).toString());
      case WEEKLY -> {
        LocalDate start = options.start();
        DayOfWeek first = options.firstWeekday();
        long offset = (start.getDayOfWeek().getValue() - first.getValue() + 7) % 7;
        LocalDate weekStart = dateOf(options, day).with(TemporalAdjusters.previousOrSame(first));
        yield new Bucket((day - 1 + offset) / 7 + 1, weekStart.toString());
      }
      case MONTHLY -> {
        YearMonth month = YearMonth.from(dateOf(options, day));
        long index = ChronoUnit.MONTHS.between(YearMonth.from(options.start()), month) + 1;
        yield new Bucket(index, month.toString());
      }
      default -> new Bucket(1L, ANNUAL_LABEL);
    };
  }

  private static LocalDate dateOf(SimulationOptions options, long day) {
    return options.start().plusDays(day - 1);
  }

  record Bucket(long index, String label) {}
}
