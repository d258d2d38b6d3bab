package com.ospicorp.tumorgrowth.growth.model;

import java.util.List;

public record WeightPredictionReport(
    double targetDay,
    List<WeightPrediction> predictions,
    List<WeightCheck> experimentalWeights,
    List<IntervalComparison> comparisons
) {}
