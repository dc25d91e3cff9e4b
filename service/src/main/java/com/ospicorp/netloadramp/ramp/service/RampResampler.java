package com.ospicorp.netloadramp.ramp.service;

import static com.ospicorp.netloadramp.ramp.model.enums.Aggregation.MAX;
import static com.ospicorp.netloadramp.ramp.model.enums.Aggregation.MEAN;
import static com.ospicorp.netloadramp.ramp.model.enums.Aggregation.MIN;
import static com.ospicorp.netloadramp.ramp.service.RampCalculator.RAMP_COLUMNS;

import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.Aggregation;
import com.ospicorp.netloadramp.ramp.model.enums.TimeStep;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings an hourly ramp table to the requested time step. Outside of the hourly detailed
 * case every ramp is reported as its average, minimum and maximum over the period, in
 * columns {@code avg_<ramp>}, {@code min_<ramp>}, {@code max_<ramp>}.
 */
public final class RampResampler {
  static final String AVG = "avg";
  private static final List<Aggregation> PER_RAMP = List.of(MEAN, MIN, MAX);

  private RampResampler() {
  }

  public static TimeSeriesTable resample(TimeSeriesTable ramps, TimeStep timeStep,
      boolean synthesis) {
    if (synthesis) {
      TimeSeriesTable synthetic = Synthesizer.synthesize(ramps, AVG, MIN, MAX);
      List<Aggregation> funs = new ArrayList<>();
      RAMP_COLUMNS.forEach(c -> funs.addAll(PER_RAMP));
      return TimeStepConverter.changeTimeStep(synthetic, timeStep, funs);
    }
    if (timeStep == TimeStep.HOURLY) return ramps;

    TimeSeriesTable x = ramps;
    for (String ramp : RAMP_COLUMNS) {
      x = x.withColumn(MIN.prefix() + "_" + ramp, ramps.column(ramp));
    }
    for (String ramp : RAMP_COLUMNS) {
      x = x.withColumn(MAX.prefix() + "_" + ramp, ramps.column(ramp));
    }
    List<Aggregation> funs = List.of(MEAN, MEAN, MEAN, MIN, MIN, MIN, MAX, MAX, MAX);
    x = TimeStepConverter.changeTimeStep(x, timeStep, funs);

    List<String> order = new ArrayList<>();
    Map<String, String> renames = new LinkedHashMap<>();
    for (String ramp : RAMP_COLUMNS) {
      order.add(ramp);
      order.add(MIN.prefix() + "_" + ramp);
      order.add(MAX.prefix() + "_" + ramp);
      renames.put(ramp, AVG + "_" + ramp);
    }
    return x.select(order).renamed(renames);
  }
}
