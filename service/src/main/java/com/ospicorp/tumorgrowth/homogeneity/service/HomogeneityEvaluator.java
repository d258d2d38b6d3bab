package com.ospicorp.tumorgrowth.homogeneity.service;

import com.ospicorp.tumorgrowth.homogeneity.model.GroupHomogeneity;
import com.ospicorp.tumorgrowth.homogeneity.model.HomogeneityReport;
import com.ospicorp.tumorgrowth.homogeneity.model.HomogeneityThresholds;
import com.ospicorp.tumorgrowth.homogeneity.model.OverallAssessment;
import com.ospicorp.tumorgrowth.homogeneity.model.OverallRecommendation;
import com.ospicorp.tumorgrowth.homogeneity.model.Quality;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.model.Recommendation;
import com.ospicorp.tumorgrowth.model.RecommendationLevel;
import com.ospicorp.tumorgrowth.stats.BasicStats;
import com.ospicorp.tumorgrowth.stats.Statistics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Scores how comparable the baseline measurements of each group are. */
@Service
public class HomogeneityEvaluator {
  private static final Logger log = LoggerFactory.getLogger(HomogeneityEvaluator.class);

  static final int SMALL_SAMPLE = 5;
  static final int VERY_SMALL_SAMPLE = 3;

  private final HomogeneityThresholds thresholds;

  @Autowired
  public HomogeneityEvaluator(
      @Value("${tumorgrowth.homogeneity.excellent-cv:15}") double excellentCv,
      @Value("${tumorgrowth.homogeneity.good-cv:25}") double goodCv,
      @Value("${tumorgrowth.homogeneity.poor-cv:30}") double poorCv,
      @Value("${tumorgrowth.homogeneity.small-sample-factor:0.8}") double smallSampleFactor,
      @Value("${tumorgrowth.homogeneity.very-small-sample-factor:0.6}") double verySmallSampleFactor) {
    this(new HomogeneityThresholds(excellentCv, goodCv, poorCv, smallSampleFactor, verySmallSampleFactor));
  }

  public HomogeneityEvaluator(HomogeneityThresholds thresholds) {
    this.thresholds = thresholds;
  }

  public HomogeneityThresholds thresholds() {
    return thresholds;
  }

  public HomogeneityReport evaluate(List<AnimalRecord> animals) {
    List<AnimalRecord> input = animals == null ? List.of()
        : animals.stream().filter(a -> a != null).toList();
    Map<String, List<AnimalRecord>> groups = Statistics.groupBy(input, AnimalRecord::groupKey);

    Map<String, GroupHomogeneity> byGroup = new LinkedHashMap<>();
    groups.forEach((name, members) -> byGroup.put(name, analyzeGroup(name, members)));
    OverallAssessment overall = overall(byGroup.values());
    List<Recommendation> recommendations = recommendations(byGroup.values(), overall);

    log.info("Homogeneity: {} animal(s) in {} group(s), average CV {} -> {}",
        input.size(), groups.size(), overall.averageCV(), overall.recommendation());
    return new HomogeneityReport(input.size(), groups.size(), byGroup, overall, recommendations);
  }

  public GroupHomogeneity analyzeGroup(String groupName, List<AnimalRecord> members) {
    int n = members.size();
    List<Double> baselines = new ArrayList<>(n);
    for (AnimalRecord animal : members) {
      baselines.add(baseline(animal));
    }
    List<Double> valid = Statistics.validNumbers(baselines, true);
    if (valid.isEmpty()) {
      return GroupHomogeneity.insufficient(groupName, n);
    }
    BasicStats stats = Statistics.basicStats(valid);
    double cv = stats.std() / stats.mean() * 100;
    return new GroupHomogeneity(groupName, n, true, valid, round(stats.mean(), 2), round(stats.std(), 2),
        round(cv, 1), (int) Math.round(score(cv, n)), thresholds.quality(cv));
  }

  /**
   * Score in [0, 100]: CV penalty first, then the small-sample factors, which stack. Past the
   * poor threshold the score falls by 2 per CV point and never exceeds the score at the
   * threshold itself.
   */
  public double score(double cv, int n) {
    double score = 100;
    if (cv > thresholds.poorCv()) {
      score = Math.max(0, Math.min(scoreAtPoorThreshold(), 100 - (cv - thresholds.poorCv()) * 2));
    } else if (cv > thresholds.excellentCv()) {
      score = 95 - (cv - thresholds.excellentCv());
    }
    if (n < SMALL_SAMPLE) {
      score *= thresholds.smallSampleFactor();
    }
    if (n < VERY_SMALL_SAMPLE) {
      score *= thresholds.verySmallSampleFactor();
    }
    return score;
  }

  private double scoreAtPoorThreshold() {
    double poor = thresholds.poorCv();
    double excellent = thresholds.excellentCv();
    return poor > excellent ? 95 - (poor - excellent) : 100;
  }

  OverallAssessment overall(Iterable<GroupHomogeneity> groups) {
    double cvSum = 0;
    double scoreSum = 0;
    int count = 0;
    for (GroupHomogeneity g : groups) {
      if (g.hasBaseline()) {
        cvSum += g.cv();
        scoreSum += g.homogeneityScore();
        count++;
      }
    }
    if (count == 0) {
      return OverallAssessment.insufficient();
    }
    double averageCv = cvSum / count;
    Quality quality = thresholds.quality(averageCv);
    OverallRecommendation recommendation = switch (quality) {
      case POOR -> OverallRecommendation.REVIEW;
      case FAIR -> OverallRecommendation.CAUTION;
      default -> OverallRecommendation.PROCEED;
    };
    return new OverallAssessment(round(averageCv, 1), (int) Math.round(scoreSum / count), quality, recommendation);
  }

  List<Recommendation> recommendations(Iterable<GroupHomogeneity> groups, OverallAssessment overall) {
    List<Recommendation> out = new ArrayList<>();
    String averageCv = formatCv(overall.averageCV());
    if (overall.recommendation() == OverallRecommendation.REVIEW) {
      out.add(new Recommendation(RecommendationLevel.ERROR, "experimental", "High Baseline Variability Detected",
          "Average CV = " + averageCv + "% across groups",
          "Consider reviewing randomization or excluding high-variance animals", null));
    } else if (overall.recommendation() == OverallRecommendation.CAUTION) {
      out.add(new Recommendation(RecommendationLevel.WARNING, "experimental", "Moderate Baseline Variability",
          "Average CV = " + averageCv + "% may affect sensitivity",
          "Monitor closely during analysis and consider stratified analysis", null));
    }
    for (GroupHomogeneity g : groups) {
      if (g.hasBaseline() && g.cv() > thresholds.goodCv()) {
        out.add(new Recommendation(RecommendationLevel.WARNING, "group", "High Variability in " + g.groupName(),
            "CV = " + formatCv(g.cv()) + "% in group " + g.groupName(),
            "Review individual animals in this group", null));
      }
      if (g.n() < SMALL_SAMPLE) {
        out.add(new Recommendation(RecommendationLevel.INFO, "statistical", "Small Sample Size in " + g.groupName(),
            "Only " + g.n() + " animals in group " + g.groupName(),
            "Consider increasing sample size for better statistical power", null));
      }
    }
    if (out.isEmpty()) {
      out.add(new Recommendation(RecommendationLevel.SUCCESS, "experimental", "Excellent Model Homogeneity",
          "Average CV = " + averageCv + "% - Model ready for analysis",
          "Proceed with confidence to main analysis", null));
    }
    return List.copyOf(out);
  }

  /** Measurement at day 0 when the series has one, otherwise the first measurement. */
  static Double baseline(AnimalRecord animal) {
    int idx = animal.indexOfDay(0d);
    if (idx >= 0) {
      return animal.measurements().get(idx);
    }
    return animal.measurements().isEmpty() ? null : animal.measurements().get(0);
  }

  private static double round(double value, int decimals) {
    return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
  }

  private static String formatCv(Double cv) {
    return cv == null ? "n/a" : BigDecimal.valueOf(cv).setScale(1, RoundingMode.HALF_UP).toPlainString();
  }
}
