package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.SimulationOptions;
import com.ospicorp.netloadramp.ramp.model.TableAttributes;
import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.TableType;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

final class RampFixtures {
  static final SimulationOptions OPTIONS =
      new SimulationOptions("test", LocalDate.of(2018, 1, 1), DayOfWeek.MONDAY, 2);

  private RampFixtures() {
  }

  /** Single area, hourly, timeId 1..3, BALANCE [10, 15, 5], netLoad [100, 90, 95]. */
  static TimeSeriesTable singleArea() {
    return TimeSeriesTable.builder(List.of("area", "timeId"), List.of("BALANCE", "netLoad"))
        .attributes(TableAttributes.hourly(TableType.AREAS, OPTIONS))
        .row("fr", 1, 10, 100)
        .row("fr", 2, 15, 90)
        .row("fr", 3, 5, 95)
        .build();
  }

  /** Area "fr" over two Monte-Carlo years, rows deliberately out of order. */
  static TimeSeriesTable twoMcYears() {
    return TimeSeriesTable.builder(List.of("area", "mcYear", "timeId"),
            List.of("BALANCE", "netLoad"))
        .attributes(TableAttributes.hourly(TableType.AREAS, OPTIONS))
        .row("fr", 2, 3, 30, 60)
        .row("fr", 1, 1, 10, 100)
        .row("fr", 2, 1, 0, 50)
        .row("fr", 1, 2, 15, 90)
        .row("fr", 2, 2, 10, 70)
        .row("fr", 1, 3, 5, 95)
        .build();
  }

  static TimeSeriesTable districts() {
    return TimeSeriesTable.builder(List.of("district", "timeId"), List.of("BALANCE", "netLoad"))
        .attributes(TableAttributes.hourly(TableType.DISTRICTS, OPTIONS))
        .row("north", 1, 1, 20)
        .row("north", 2, 3, 25)
        .build();
  }
}
