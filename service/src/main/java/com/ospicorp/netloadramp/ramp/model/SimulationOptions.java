package com.ospicorp.netloadramp.ramp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Description of the simulation a dataset was read from. The calendar fields are what the
 * time step conversion needs to place hourly rows into days, weeks and months.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationOptions(
    @JsonProperty("simulation_name") String simulationName,
    LocalDate start,
    @JsonProperty("first_weekday") DayOfWeek firstWeekday,
    @JsonProperty("mc_years") Integer mcYears
) {

  public SimulationOptions {
    if (firstWeekday == null) {
      firstWeekday = DayOfWeek.MONDAY;
    }
  }
}
