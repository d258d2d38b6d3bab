package com.ospicorp.tumorgrowth.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RecommendationLevel {
  SUCCESS, INFO, WARNING, ERROR;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
