package com.ospicorp.tumorgrowth.homogeneity.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Baseline comparability of one group. Mean and std are rounded to 2 decimals, cv to 1. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupHomogeneity(
    String groupName,
    int n,
    boolean hasBaseline,
    List<Double> baselineValues,
    Double mean,
    Double stdDev,
    Double cv,
    int homogeneityScore,
    Quality quality
) {

  public static GroupHomogeneity insufficient(String groupName, int n) {
    return new GroupHomogeneity(groupName, n, false, null, null, null, null, 0, Quality.INSUFFICIENT);
  }
}
