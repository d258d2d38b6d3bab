package com.ospicorp.tumorgrowth.homogeneity.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Quality {
  EXCELLENT, GOOD, FAIR, POOR, INSUFFICIENT;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
