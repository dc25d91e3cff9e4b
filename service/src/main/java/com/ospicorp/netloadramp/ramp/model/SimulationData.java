package com.ospicorp.netloadramp.ramp.model;

/**
 * Data read from a simulation: either a single tagged table or a list of tables by kind.
 */
public sealed interface SimulationData permits TimeSeriesTable, SimulationDataList {

  TableAttributes attributes();
}
