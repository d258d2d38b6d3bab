package com.ospicorp.tumorgrowth.outlier.service;

import com.ospicorp.tumorgrowth.outlier.model.Decision;
import com.ospicorp.tumorgrowth.outlier.model.DecisionType;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import com.ospicorp.tumorgrowth.outlier.model.Flag;
import java.util.ArrayList;
import java.util.List;

/** Derives one decision per flag. Cost is linear in the number of flags; animals are not revisited. */
public final class DecisionEngine {

  static final String BASELINE_REASON = "Day 0 always preserved";
  static final String INCLUDE_REASON = "Within normal criteria";

  private DecisionEngine() {}

  public static List<Decision> decide(List<Flag> flags, FilteringStrictness strictness) {
    List<Decision> decisions = new ArrayList<>(flags.size());
    for (int i = 0; i < flags.size(); i++) {
      decisions.add(decide(i, flags.get(i), strictness));
    }
    return List.copyOf(decisions);
  }

  static Decision decide(int flagId, Flag flag, FilteringStrictness strictness) {
    if (flag.isBaseline()) {
      return new Decision(flagId, flag.animalId(), flag.day(), DecisionType.INCLUDE, BASELINE_REASON, true);
    }
    if (strictness.excludes(flag.severity())) {
      return new Decision(flagId, flag.animalId(), flag.day(), DecisionType.EXCLUDE,
          flag.severity().code() + " anomaly detected", true);
    }
    return new Decision(flagId, flag.animalId(), flag.day(), DecisionType.INCLUDE, INCLUDE_REASON, true);
  }
}
