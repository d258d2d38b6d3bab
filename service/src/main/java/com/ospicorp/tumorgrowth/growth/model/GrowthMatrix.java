package com.ospicorp.tumorgrowth.growth.model;

import java.util.List;
import java.util.Map;

/**
 * Mean growth rate between every pair of observed days of one group. {@code values} is
 * symmetric with a zero diagonal; {@code individualData} is keyed {@code "x-y"} with x < y.
 */
public record GrowthMatrix(
    String group,
    List<Double> days,
    List<List<Double>> values,
    Map<String, List<Double>> individualData
) {

  public static String intervalKey(double fromDay, double toDay) {
    return formatDay(fromDay) + "-" + formatDay(toDay);
  }

  public static String formatDay(double day) {
    if (day == Math.rint(day) && !Double.isInfinite(day)) {
      return Long.toString((long) day);
    }
    return Double.toString(day);
  }
}
