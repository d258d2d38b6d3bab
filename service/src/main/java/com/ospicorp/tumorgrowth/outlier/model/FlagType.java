package com.ospicorp.tumorgrowth.outlier.model;

public enum FlagType {
  IMPOSSIBLE_VALUE(new FlagInfo(Severity.CRITICAL, "Impossible Value", "#dc3545")),
  EXTREME_GROWTH(new FlagInfo(Severity.CRITICAL, "Extreme Growth", "#dc3545")),
  EXTREME_DECLINE(new FlagInfo(Severity.CRITICAL, "Extreme Decline", "#dc3545")),
  INTRA_ANIMAL_OUTLIER(new FlagInfo(Severity.HIGH, "Intra-Animal Outlier", "#fd7e14")),
  GROUP_OUTLIER(new FlagInfo(Severity.MEDIUM, "Group Outlier", "#ffc107")),
  LAST_DAY_DROP(new FlagInfo(Severity.MEDIUM, "Last Day Drop", "#ffc107"));

  private final FlagInfo info;

  FlagType(FlagInfo info) {
    this.info = info;
  }

  public FlagInfo info() {
    return info;
  }

  public Severity severity() {
    return info.severity();
  }
}
