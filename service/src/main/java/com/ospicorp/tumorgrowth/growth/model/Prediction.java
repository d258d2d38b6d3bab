package com.ospicorp.tumorgrowth.growth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Extrapolation of one animal's growth model to {@code targetDay}. When {@code error} is set the
 * predicted values are absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Prediction(
    String animalId,
    String group,
    double targetDay,
    GrowthModel model,
    FitQuality fitQuality,
    Double predictedMeasurement,
    Double predictedWeight,
    List<Double> availableDays,
    Double minDay,
    Double maxDay,
    String error
) {}
