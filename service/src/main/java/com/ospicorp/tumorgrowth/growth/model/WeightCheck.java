package com.ospicorp.tumorgrowth.growth.model;

/**
 * A recorded weight next to the model's value at the target day. {@code predictionError} is the
 * percent difference from the measurement taken on that day, when one exists.
 */
public record WeightCheck(
    String animalId,
    String group,
    double experimentalWeight,
    Double predictionError,
    Double sacrificeDay,
    Double actualMeasurement,
    Double predictedMeasurement
) {}
