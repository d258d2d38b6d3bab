package com.ospicorp.tumorgrowth.homogeneity.model;

public record OverallAssessment(Double averageCV, int overallScore, Quality quality,
    OverallRecommendation recommendation) {

  public static OverallAssessment insufficient() {
    return new OverallAssessment(null, 0, Quality.INSUFFICIENT, OverallRecommendation.REVIEW);
  }
}
