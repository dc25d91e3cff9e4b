package com.ospicorp.netloadramp.ramp.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TableType {
  AREAS("areas"),
  DISTRICTS("districts"),
  LINKS("links"),
  NET_LOAD_RAMP("netLoadRamp");

  private final String code;

  TableType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static TableType fromCode(String code) {
    for (TableType type : values()) {
      if (type.code.equalsIgnoreCase(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown table type: " + code);
  }
}
