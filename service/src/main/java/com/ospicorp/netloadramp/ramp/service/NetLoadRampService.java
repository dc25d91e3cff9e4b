package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.SimulationData;
import com.ospicorp.netloadramp.ramp.model.SimulationDataList;
import com.ospicorp.netloadramp.ramp.model.SimulationOptions;
import com.ospicorp.netloadramp.ramp.model.TableAttributes;
import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.TableType;
import com.ospicorp.netloadramp.ramp.model.enums.TimeStep;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the ramp computation for a single area/district table or for a list
 * holding both.
 */
@Service
public class NetLoadRampService {
  private static final Logger log = LoggerFactory.getLogger(NetLoadRampService.class);
  private static final Set<TableType> SUPPORTED = Set.of(TableType.AREAS, TableType.DISTRICTS);
  private static final Set<TimeStep> CALENDAR_STEPS =
      Set.of(TimeStep.DAILY, TimeStep.WEEKLY, TimeStep.MONTHLY);

  private final RampCalculator calculator;

  public NetLoadRampService(RampCalculator calculator) {
    this.calculator = calculator;
  }

  /**
   * Computes net load, balance and area ramps.
   *
   * @param data hourly detailed area and/or district data
   * @param timeStep time step of the result
   * @param synthesis whether ramps are summarized over Monte-Carlo years
   * @param ignoreMustRun whether must-run production is left out when net load is derived
   * @param options simulation description; when null, the one attached to {@code data}
   */
  public RampResult computeRamp(SimulationData data, TimeStep timeStep, boolean synthesis,
      boolean ignoreMustRun, SimulationOptions options) {
    Objects.requireNonNull(data, "data must be provided");
    Objects.requireNonNull(timeStep, "timeStep must be provided");
    SimulationOptions opts = options != null ? options
        : data.attributes() != null ? data.attributes().options() : null;

    if (data instanceof SimulationDataList list) {
      return computeList(list, timeStep, synthesis, ignoreMustRun, opts);
    }
    if (data instanceof TimeSeriesTable table) {
      return computeTable(table, timeStep, synthesis, ignoreMustRun, opts);
    }
    throw new IllegalArgumentException("Unsupported data: " + data.getClass().getName());
  }

  private RampResult computeList(SimulationDataList list, TimeStep timeStep, boolean synthesis,
      boolean ignoreMustRun, SimulationOptions opts) {
    if (list.areas() == null && list.districts() == null) {
      throw new InvalidSimulationDataException("'x' does not contain area or district data",
          InvalidSimulationDataException.NO_AREA_OR_DISTRICT);
    }

    TimeSeriesTable areasIn = list.areas();
    TimeSeriesTable districtsIn = list.districts();
    TimeSeriesTable areas = null;
    TimeSeriesTable districts = null;
    if (list.areas() != null) {
      RampResult result = computeTable(list.areas(), timeStep, synthesis, ignoreMustRun, opts);
      areasIn = (TimeSeriesTable) result.resolvedInput();
      areas = (TimeSeriesTable) result.ramps();
    }
    if (list.districts() != null) {
      RampResult result =
          computeTable(list.districts(), timeStep, synthesis, ignoreMustRun, opts);
      districtsIn = (TimeSeriesTable) result.resolvedInput();
      districts = (TimeSeriesTable) result.ramps();
    }
    if (areas == null && districts == null) {
      throw new InvalidSimulationDataException("'x' needs to contain area and/or district data.",
          InvalidSimulationDataException.NO_AREA_OR_DISTRICT);
    }

    TableAttributes attributes = new TableAttributes(null, timeStep, synthesis, opts);
    return new RampResult(
        new SimulationDataList(areasIn, districtsIn, list.attributes()),
        new SimulationDataList(areas, districts, attributes));
  }

  private RampResult computeTable(TimeSeriesTable table, TimeStep timeStep, boolean synthesis,
      boolean ignoreMustRun, SimulationOptions opts) {
    TableType type = table.attributes() != null ? table.attributes().type() : null;
    if (type == null || !SUPPORTED.contains(type)) {
      throw new InvalidSimulationDataException("'x' does not contain area or district data",
          InvalidSimulationDataException.UNSUPPORTED_TYPE);
    }
    if (CALENDAR_STEPS.contains(timeStep) && (opts == null || opts.start() == null)) {
      throw new InvalidSimulationDataException(
          "Simulation start date is required to build " + timeStep.code() + " time steps",
          InvalidSimulationDataException.MISSING_START_DATE);
    }
    log.debug("Computing {} ramps on {} rows (timeStep={}, synthesis={})", type.code(),
        table.rowCount(), timeStep.code(), synthesis);

    RampCalculator.Computation computation = calculator.compute(table, ignoreMustRun);
    TimeSeriesTable hourly = computation.ramps()
        .withAttributes(TableAttributes.hourly(TableType.NET_LOAD_RAMP, opts));
    TimeSeriesTable ramps = RampResampler.resample(hourly, timeStep, synthesis)
        .withAttributes(new TableAttributes(TableType.NET_LOAD_RAMP, timeStep, synthesis, opts));
    return new RampResult(computation.resolvedInput(), ramps);
  }
}
