package com.ospicorp.netloadramp.ramp.model;

/**
 * Container holding area and/or district tables read together. Either table may be null.
 */
public record SimulationDataList(
    TimeSeriesTable areas,
    TimeSeriesTable districts,
    TableAttributes attributes
) implements SimulationData {

  public SimulationDataList withAttributes(TableAttributes newAttributes) {
    return new SimulationDataList(areas, districts, newAttributes);
  }
}
