package com.ospicorp.tumorgrowth.outlier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of measurement in the series: caliper volume or bioluminescence signal. */
public enum DataType {
  VOLUME, BLI;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DataType fromCode(String code) {
    try {
      return valueOf(code.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new IllegalArgumentException("Unknown data type: " + code, ex);
    }
  }
}
