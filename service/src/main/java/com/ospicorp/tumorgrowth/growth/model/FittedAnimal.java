package com.ospicorp.tumorgrowth.growth.model;

import java.util.List;

public record FittedAnimal(
    String id,
    String group,
    List<Double> timePoints,
    List<Double> measurements,
    GrowthModel model,
    AnimalMetrics metrics,
    boolean accepted
) {}
