package com.ospicorp.tumorgrowth.outlier.model;

import java.util.List;

public record PointFilteredAnimal(
    String id,
    String group,
    List<Double> timePoints,
    List<Double> measurements,
    List<ExcludedPoint> excludedPoints
) {}
