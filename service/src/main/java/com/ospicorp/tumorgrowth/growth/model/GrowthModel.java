package com.ospicorp.tumorgrowth.growth.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Exponential fit {@code y = a * e^(r * t)}. A model with a non-null {@code error} is
 * degenerate: {@code a = 1, r = 0, r2 = 0}.
 */
public record GrowthModel(double a, double r, double r2, int validPoints, String equation, String error) {

  public static GrowthModel insufficient(int validPoints) {
    return new GrowthModel(1d, 0d, 0d, validPoints, "Insufficient data", "Less than 3 valid points");
  }

  public static GrowthModel failed(int validPoints, String error) {
    return new GrowthModel(1d, 0d, 0d, validPoints, "Error in calculation", error);
  }

  @JsonIgnore
  public boolean isValid() {
    return error == null;
  }
}
