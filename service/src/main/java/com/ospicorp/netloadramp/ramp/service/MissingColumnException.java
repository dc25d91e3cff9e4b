package com.ospicorp.netloadramp.ramp.service;

import java.util.List;

public class MissingColumnException extends InvalidSimulationDataException {
  public static final int MISSING_COLUMN = 2001;

  private final List<String> columns;

  public MissingColumnException(List<String> columns) {
    super(message(columns), MISSING_COLUMN);
    this.columns = List.copyOf(columns);
  }

  public List<String> columns() {
    return columns;
  }

  private static String message(List<String> columns) {
    if (columns.size() == 1) {
      return "Column '" + columns.get(0) + "' is needed but missing.";
    }
    return "Columns '" + String.join("', '", columns) + "' are needed but missing.";
  }
}
