package com.ospicorp.tumorgrowth.growth.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse reading of a fit's R². */
public enum FitQuality {
  EXCELLENT, GOOD, FAIR, POOR;

  public static FitQuality of(double r2) {
    if (r2 >= 0.9) return EXCELLENT;
    if (r2 >= 0.8) return GOOD;
    if (r2 >= 0.7) return FAIR;
    return POOR;
  }

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
