package com.ospicorp.tumorgrowth.outlier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/** Which flag severities lead to exclusion; each level includes the previous one. */
public enum FilteringStrictness {
  CRITICAL("critical", EnumSet.of(Severity.CRITICAL)),
  CRITICAL_AND_HIGH("criticalAndHigh", EnumSet.of(Severity.CRITICAL, Severity.HIGH)),
  ALL("all", EnumSet.allOf(Severity.class));

  private final String code;
  private final Set<Severity> excluded;

  FilteringStrictness(String code, Set<Severity> excluded) {
    this.code = code;
    this.excluded = excluded;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public boolean excludes(Severity severity) {
    return excluded.contains(severity);
  }

  @JsonCreator
  public static FilteringStrictness fromCode(String code) {
    return Arrays.stream(values())
        .filter(s -> s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown filtering strictness: " + code));
  }
}
