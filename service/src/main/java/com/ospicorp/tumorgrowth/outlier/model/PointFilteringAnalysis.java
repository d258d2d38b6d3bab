package com.ospicorp.tumorgrowth.outlier.model;

import java.util.List;

public record PointFilteringAnalysis(
    List<PointFilteredAnimal> animals,
    int excludedPoints,
    int totalPointsOriginal,
    int totalPointsFiltered
) {}
