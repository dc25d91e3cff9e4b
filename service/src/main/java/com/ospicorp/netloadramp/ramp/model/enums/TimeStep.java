package com.ospicorp.netloadramp.ramp.model.enums;

import java.util.Locale;

public enum TimeStep {
  HOURLY,
  DAILY,
  WEEKLY,
  MONTHLY,
  ANNUAL;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
