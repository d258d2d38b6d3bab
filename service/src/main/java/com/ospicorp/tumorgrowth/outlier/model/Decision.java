package com.ospicorp.tumorgrowth.outlier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** Verdict for the flag at index {@code flagId} of the analysis flag list. */
public record Decision(
    int flagId,
    String animalId,
    double day,
    DecisionType decision,
    String reason,
    boolean automatic
) {

  @JsonIgnore
  public boolean isExclude() {
    return decision == DecisionType.EXCLUDE;
  }
}
