package com.ospicorp.tumorgrowth.growth.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;

/** Null fields fall back to the configured defaults. */
public record BatchOptions(
    @Positive Integer batchSize,
    @DecimalMin("0.0") @DecimalMax("1.0") Double r2Threshold
) {

  public static BatchOptions defaults() {
    return new BatchOptions(null, null);
  }
}
