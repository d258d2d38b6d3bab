package com.ospicorp.tumorgrowth.outlier.service;

import com.ospicorp.tumorgrowth.model.Recommendation;
import com.ospicorp.tumorgrowth.model.RecommendationLevel;
import com.ospicorp.tumorgrowth.outlier.model.DualAnalysis;
import com.ospicorp.tumorgrowth.outlier.model.Flag;
import com.ospicorp.tumorgrowth.outlier.model.FlagType;
import com.ospicorp.tumorgrowth.outlier.model.Severity;
import java.util.ArrayList;
import java.util.List;

/** Advisory messages derived from flag counts and filtering impact. */
public final class RecommendationGenerator {

  static final int LAST_DAY_DROP_MIN = 3;
  static final int EXTREME_GROWTH_MIN = 2;
  static final int EXTREME_DECLINE_MIN = 2;
  static final int MEASUREMENTS_EXCLUDED_NOTICE = 5;

  private RecommendationGenerator() {}

  public static List<Recommendation> specific(List<Flag> flags) {
    List<Recommendation> out = new ArrayList<>();

    List<Flag> drops = ofType(flags, FlagType.LAST_DAY_DROP);
    if (drops.size() >= LAST_DAY_DROP_MIN) {
      out.add(new Recommendation(RecommendationLevel.WARNING, "temporal", "Last Day Drops",
          "Detected " + drops.size() + " drops", "Review last time point", animalIds(drops)));
    }

    List<Flag> growth = ofType(flags, FlagType.EXTREME_GROWTH);
    if (growth.size() >= EXTREME_GROWTH_MIN) {
      out.add(new Recommendation(RecommendationLevel.INFO, "biological", "Atypical Growth",
          "Extreme growth detected", "Review instrument calibration", animalIds(growth)));
    }

    List<Flag> decline = ofType(flags, FlagType.EXTREME_DECLINE);
    if (decline.size() >= EXTREME_DECLINE_MIN) {
      List<String> ids = animalIds(decline);
      String category = ids.size() == 1 ? "individual" : "systematic";
      String message = ids.size() == 1 ? "Repeated decline in a single animal" : "Multiple animals affected";
      out.add(new Recommendation(RecommendationLevel.WARNING, category, "Extreme Decline",
          message, "Review experimental conditions", ids));
    }
    return List.copyOf(out);
  }

  public static List<Recommendation> general(DualAnalysis dual, List<Flag> flags) {
    List<Recommendation> out = new ArrayList<>();
    int animalsExcluded = dual.impact().animalsExcluded();
    if (animalsExcluded > 0) {
      out.add(Recommendation.of(RecommendationLevel.WARNING, "Excluded Animals",
          "Review " + animalsExcluded + " excluded animals."));
    }
    int measurementsExcluded = dual.impact().measurementsExcluded();
    if (measurementsExcluded > MEASUREMENTS_EXCLUDED_NOTICE) {
      out.add(Recommendation.of(RecommendationLevel.INFO, "Filtering Impact",
          measurementsExcluded + " measurements affected."));
    }
    boolean anyCritical = flags.stream().anyMatch(f -> f.severity() == Severity.CRITICAL);
    if (!anyCritical) {
      out.add(Recommendation.of(RecommendationLevel.SUCCESS, "Data Quality", "No critical anomalies detected."));
    }
    return List.copyOf(out);
  }

  private static List<Flag> ofType(List<Flag> flags, FlagType type) {
    return flags.stream().filter(f -> f.type() == type).toList();
  }

  private static List<String> animalIds(List<Flag> flags) {
    return flags.stream().map(Flag::animalId).distinct().toList();
  }
}
