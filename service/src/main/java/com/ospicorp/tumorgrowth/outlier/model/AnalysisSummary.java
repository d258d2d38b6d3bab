package com.ospicorp.tumorgrowth.outlier.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Counts keyed by wire codes; every flag type, severity and decision is present, zero or not. */
public record AnalysisSummary(
    int totalFlags,
    Map<String, Integer> flagCounts,
    Map<String, Integer> severityCounts,
    Map<String, Integer> decisionCounts,
    String configUsed
) {

  public static AnalysisSummary of(List<Flag> flags, List<Decision> decisions, SensitivityProfile profile) {
    Map<String, Integer> byType = new LinkedHashMap<>();
    for (FlagType type : FlagType.values()) {
      byType.put(type.name(), 0);
    }
    Map<String, Integer> bySeverity = new LinkedHashMap<>();
    for (Severity severity : Severity.values()) {
      bySeverity.put(severity.code(), 0);
    }
    for (Flag flag : flags) {
      byType.merge(flag.type().name(), 1, Integer::sum);
      bySeverity.merge(flag.severity().code(), 1, Integer::sum);
    }
    Map<String, Integer> byDecision = new LinkedHashMap<>();
    for (DecisionType type : DecisionType.values()) {
      byDecision.put(type.name(), 0);
    }
    for (Decision decision : decisions) {
      byDecision.merge(decision.decision().name(), 1, Integer::sum);
    }
    return new AnalysisSummary(flags.size(), byType, bySeverity, byDecision, profile.name());
  }
}
