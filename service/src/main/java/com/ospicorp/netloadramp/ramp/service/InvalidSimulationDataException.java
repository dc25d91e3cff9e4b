package com.ospicorp.netloadramp.ramp.service;

/**
 * Raised when the data handed to a computation does not have the structure it requires.
 */
public class InvalidSimulationDataException extends RuntimeException {
  public static final int UNSUPPORTED_TYPE = 2002;
  public static final int NO_AREA_OR_DISTRICT = 2003;
  public static final int NOT_HOURLY_DETAIL = 2004;
  public static final int MISSING_START_DATE = 2005;

  private final int errorCode;

  public InvalidSimulationDataException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }
}
