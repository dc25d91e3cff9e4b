package com.ospicorp.netloadramp.ramp.controller;

/**
 * Query parameter of a ramp request that cannot be parsed, reported with a documented
 * error code.
 */
public class InvalidParameterException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final String parameter;
  private final int errorCode;

  public InvalidParameterException(String parameter, String message, int errorCode) {
    super(message);
    this.parameter = parameter;
    this.errorCode = errorCode;
  }

  public String parameter() {
    return parameter;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
