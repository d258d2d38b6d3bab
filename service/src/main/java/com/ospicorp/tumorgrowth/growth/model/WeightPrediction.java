package com.ospicorp.tumorgrowth.growth.model;

public record WeightPrediction(
    String animalId,
    String group,
    double predictedVolume,
    double predictedWeight,
    double experimentalWeight,
    double targetDay,
    double r2
) {}
