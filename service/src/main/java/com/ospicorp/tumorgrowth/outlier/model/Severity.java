package com.ospicorp.tumorgrowth.outlier.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
  CRITICAL, HIGH, MEDIUM, LOW;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
