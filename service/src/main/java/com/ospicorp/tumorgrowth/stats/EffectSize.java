package com.ospicorp.tumorgrowth.stats;

public record EffectSize(double value, String description) {

  static final String INSUFFICIENT = "Insufficient data";
  static final String NONE = "None";
}
