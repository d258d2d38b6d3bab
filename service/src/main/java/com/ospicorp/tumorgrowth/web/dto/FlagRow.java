package com.ospicorp.tumorgrowth.web.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.tumorgrowth.outlier.model.Flag;

/** Flat flag view used for CSV export. */
@JsonPropertyOrder({"animalId", "group", "day", "value", "type", "severity", "message"})
public record FlagRow(String animalId, String group, double day, Double value, String type, String severity,
    String message) {

  public static FlagRow of(Flag flag) {
    return new FlagRow(flag.animalId(), flag.group(), flag.day(), flag.value(), flag.type().name(),
        flag.severity().code(), flag.message());
  }
}
