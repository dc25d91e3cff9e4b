package com.ospicorp.netloadramp.ramp.model;

import com.ospicorp.netloadramp.ramp.model.enums.TableType;
import com.ospicorp.netloadramp.ramp.model.enums.TimeStep;

/**
 * Metadata attached to a table or a list of tables: what kind of rows it holds, their time
 * step, whether Monte-Carlo years were synthesized, and the simulation they come from.
 * {@code type} is null on containers.
 */
public record TableAttributes(
    TableType type,
    TimeStep timeStep,
    boolean synthesis,
    SimulationOptions options
) {

  public static TableAttributes hourly(TableType type, SimulationOptions options) {
    return new TableAttributes(type, TimeStep.HOURLY, false, options);
  }

  public TableAttributes withTimeStep(TimeStep newTimeStep) {
    return new TableAttributes(type, newTimeStep, synthesis, options);
  }

  public TableAttributes withSynthesis(boolean newSynthesis) {
    return new TableAttributes(type, timeStep, newSynthesis, options);
  }
}
