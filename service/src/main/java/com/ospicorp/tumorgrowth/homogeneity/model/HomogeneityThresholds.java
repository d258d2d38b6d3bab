package com.ospicorp.tumorgrowth.homogeneity.model;

/** CV limits in percent and the score factors applied below n=5 and n=3. */
public record HomogeneityThresholds(
    double excellentCv,
    double goodCv,
    double poorCv,
    double smallSampleFactor,
    double verySmallSampleFactor
) {

  public static HomogeneityThresholds defaults() {
    return new HomogeneityThresholds(15, 25, 30, 0.8, 0.6);
  }

  public Quality quality(double cv) {
    if (cv > poorCv) return Quality.POOR;
    if (cv > goodCv) return Quality.FAIR;
    if (cv > excellentCv) return Quality.GOOD;
    return Quality.EXCELLENT;
  }
}
