package com.ospicorp.tumorgrowth.growth.service;

import com.ospicorp.tumorgrowth.growth.model.GrowthModel;
import com.ospicorp.tumorgrowth.stats.Statistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fits {@code measurement(t) = a * e^(r * t)} by ordinary least squares on
 * {@code ln(measurement)} against time.
 */
public final class GrowthModelFitter {

  static final int MIN_POINTS = 3;

  private GrowthModelFitter() {
  }

  /**
   * @throws IllegalArgumentException if either list is {@code null} or their lengths differ
   */
  public static GrowthModel fit(List<Double> timePoints, List<Double> measurements) {
    if (timePoints == null || measurements == null) {
      throw new IllegalArgumentException("timePoints and measurements must be provided");
    }
    if (timePoints.size() != measurements.size()) {
      throw new IllegalArgumentException("timePoints and measurements differ in length ("
          + timePoints.size() + " vs " + measurements.size() + ")");
    }

    List<double[]> valid = new ArrayList<>(timePoints.size());
    for (int i = 0; i < timePoints.size(); i++) {
      Double x = timePoints.get(i);
      Double y = measurements.get(i);
      if (x != null && y != null && Double.isFinite(x) && Double.isFinite(y) && y > 0d) {
        valid.add(new double[] {x, Math.log(y)});
      }
    }
    if (valid.size() < MIN_POINTS) {
      return GrowthModel.insufficient(valid.size());
    }

    try {
      return regress(valid);
    } catch (InsufficientVariationException ex) {
      return GrowthModel.failed(valid.size(), ex.getMessage());
    }
  }

  private static GrowthModel regress(List<double[]> points) {
    int n = points.size();
    double sumX = 0d;
    double sumY = 0d;
    double sumXY = 0d;
    double sumX2 = 0d;
    for (double[] p : points) {
      sumX += p[0];
      sumY += p[1];
      sumXY += p[0] * p[1];
      sumX2 += p[0] * p[0];
    }

    double denominator = n * sumX2 - sumX * sumX;
    if (Math.abs(denominator) <= Statistics.EPSILON) {
      throw new InsufficientVariationException();
    }

    double slope = (n * sumXY - sumX * sumY) / denominator;
    double lnA = (sumY - slope * sumX) / n;

    double yMean = sumY / n;
    double ssRes = 0d;
    double ssTot = 0d;
    for (double[] p : points) {
      double predicted = lnA + slope * p[0];
      ssRes += Math.pow(p[1] - predicted, 2);
      ssTot += Math.pow(p[1] - yMean, 2);
    }
    double r2 = ssTot > Statistics.EPSILON ? Math.max(0d, 1 - ssRes / ssTot) : 0d;

    double a = Math.exp(lnA);
    double safeA = Double.isFinite(a) ? a : 1d;
    double safeR = Double.isFinite(slope) ? slope : 0d;
    double safeR2 = Double.isFinite(r2) ? r2 : 0d;
    return new GrowthModel(safeA, safeR, safeR2, n, equation(safeA, safeR), null);
  }

  static String equation(double a, double r) {
    return String.format(Locale.ROOT, "y = %.2f × e^(%.4f×t)", a, r);
  }

  private static final class InsufficientVariationException extends RuntimeException {
    InsufficientVariationException() {
      super("Cannot calculate regression: insufficient variation in X values");
    }
  }
}
