package com.ospicorp.tumorgrowth.growth.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record IntervalRef(@NotBlank String group, @NotNull Double fromDay, @NotNull Double toDay) {

  public String label() {
    return group + " " + GrowthMatrix.intervalKey(fromDay, toDay);
  }
}
