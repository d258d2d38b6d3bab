package com.ospicorp.tumorgrowth.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One animal's measurement series. Missing lists are read as empty; individual entries may be
 * {@code null} and are treated as absent by the analysis code.
 */
public record AnimalRecord(String id, String group, List<Double> timePoints, List<Double> measurements) {

  public static final String UNKNOWN_GROUP = "Unknown";

  public AnimalRecord {
    timePoints = timePoints == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(timePoints));
    measurements = measurements == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(measurements));
  }

  /** Number of usable (time point, measurement) pairs. */
  @JsonIgnore
  public int pairCount() {
    return Math.min(timePoints.size(), measurements.size());
  }

  @JsonIgnore
  public String groupKey() {
    return group == null ? UNKNOWN_GROUP : group;
  }

  /** First index whose time point equals {@code day}, or -1. */
  public int indexOfDay(double day) {
    int n = pairCount();
    for (int i = 0; i < n; i++) {
      Double t = timePoints.get(i);
      if (t != null && t == day) {
        return i;
      }
    }
    return -1;
  }

  public static boolean isPositive(Double value) {
    return value != null && Double.isFinite(value) && value > 0d;
  }

  public static boolean isFinite(Double value) {
    return value != null && Double.isFinite(value);
  }
}
