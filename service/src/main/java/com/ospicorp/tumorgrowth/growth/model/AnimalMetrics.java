package com.ospicorp.tumorgrowth.growth.model;

import java.util.List;

public record AnimalMetrics(
    double initialValue,
    double finalValue,
    double growthRatio,
    double maxValue,
    double minValue
) {

  /** Summary of a raw series; first and last entries are read as 0 when missing. */
  public static AnimalMetrics of(List<Double> measurements) {
    double max = Double.NEGATIVE_INFINITY;
    double min = Double.POSITIVE_INFINITY;
    int valid = 0;
    for (Double v : measurements) {
      if (v != null && Double.isFinite(v) && v > 0d) {
        max = Math.max(max, v);
        min = Math.min(min, v);
        valid++;
      }
    }
    if (valid == 0) {
      return new AnimalMetrics(0d, 0d, 0d, 0d, 0d);
    }
    double initial = orZero(measurements.get(0));
    double last = orZero(measurements.get(measurements.size() - 1));
    return new AnimalMetrics(initial, last, initial > 0 ? last / initial : 0d, max, min);
  }

  private static double orZero(Double value) {
    return value == null || Double.isNaN(value) ? 0d : value;
  }
}
