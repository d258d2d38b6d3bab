package com.ospicorp.tumorgrowth.outlier.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Detection thresholds. Growth and decline limits are per-day rates in log space; the IQR
 * sensitivity is the multiplier applied to the interquartile range.
 */
public record SensitivityProfile(
    @NotBlank String name,
    @NotNull @DecimalMin(value = "0.0", inclusive = false) Double maxGrowthRate,
    @NotNull @DecimalMin(value = "0.0", inclusive = false) Double maxDeclineRate,
    @NotNull @DecimalMin(value = "0.0", inclusive = false) Double iqrSensitivity,
    boolean requireMultipleFlags,
    @Min(1) int minGroupSizeForIQR,
    Double biologicalChangeThreshold
) {}
