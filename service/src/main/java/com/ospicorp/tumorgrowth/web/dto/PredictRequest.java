package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.model.AnimalRecord;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record PredictRequest(
    @NotNull AnimalRecord animal,
    @NotNull Double targetDay,
    @Positive Double lastWeight,
    Double lastWeightDay
) {}
