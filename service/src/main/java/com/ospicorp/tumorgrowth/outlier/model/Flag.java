package com.ospicorp.tumorgrowth.outlier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.tumorgrowth.growth.model.GrowthMatrix;
import jakarta.validation.constraints.NotNull;

public record Flag(
    @NotNull FlagType type,
    String animalId,
    String group,
    @NotNull Double day,
    Double value,
    String message
) {

  public static Flag of(FlagType type, String animalId, String group, double day, Double value) {
    return new Flag(type, animalId, group, day, value,
        type.info().name() + " at day " + GrowthMatrix.formatDay(day));
  }

  @JsonProperty(value = "severity", access = JsonProperty.Access.READ_ONLY)
  public Severity severity() {
    return type.severity();
  }

  @JsonIgnore
  public boolean isBaseline() {
    return day == 0d;
  }
}
