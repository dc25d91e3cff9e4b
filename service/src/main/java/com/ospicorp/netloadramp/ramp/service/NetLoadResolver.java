package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;

/**
 * Derives the {@code netLoad} column of an area or district table from its production and
 * consumption columns.
 */
public interface NetLoadResolver {

  String NET_LOAD = "netLoad";

  /**
   * Returns a copy of {@code table} with a {@code netLoad} column appended.
   *
   * @param ignoreMustRun whether must-run thermal production is left out of the computation
   */
  TimeSeriesTable addNetLoad(TimeSeriesTable table, boolean ignoreMustRun);
}
