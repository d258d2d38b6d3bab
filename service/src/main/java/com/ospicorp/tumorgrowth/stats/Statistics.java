package com.ospicorp.tumorgrowth.stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Numeric primitives shared by the outlier engine, the growth fitter and the homogeneity
 * evaluator. Every method except {@link #mannWhitneyU(Collection, Collection)} accepts empty,
 * {@code null} or non-finite input and returns a zero-valued result instead of throwing.
 */
public final class Statistics {

  private static final double ERF_A1 = 0.254829592;
  private static final double ERF_A2 = -0.284496736;
  private static final double ERF_A3 = 1.421413741;
  private static final double ERF_A4 = -1.453152027;
  private static final double ERF_A5 = 1.061405429;
  private static final double ERF_P = 0.3275911;

  /** Smallest spacing of doubles around 1.0, same value as JavaScript's Number.EPSILON. */
  public static final double EPSILON = Math.ulp(1.0);

  private Statistics() {
  }

  /**
   * Keeps the finite values of {@code values}, dropping {@code null}, NaN and infinities.
   *
   * @param values raw values, may be {@code null}
   * @param positiveOnly when {@code true} also drops values {@code <= 0}
   * @return a new list, never {@code null}
   */
  public static List<Double> validNumbers(Collection<? extends Number> values, boolean positiveOnly) {
    List<Double> out = new ArrayList<>();
    if (values == null) {
      return out;
    }
    for (Number n : values) {
      if (n == null) continue;
      double v = n.doubleValue();
      if (!Double.isFinite(v)) continue;
      if (positiveOnly && v <= 0d) continue;
      out.add(v);
    }
    return out;
  }

  public static List<Double> validNumbers(Collection<? extends Number> values) {
    return validNumbers(values, false);
  }

  public static BasicStats basicStats(Collection<? extends Number> values) {
    double[] valid = toArray(validNumbers(values));
    int n = valid.length;
    if (n == 0) {
      return BasicStats.EMPTY;
    }
    double mean = sum(valid) / n;
    double std = n > 1 ? Math.sqrt(Math.max(0d, sumSquaredDeviations(valid, mean) / (n - 1))) : 0d;
    Arrays.sort(valid);
    return new BasicStats(mean, std, valid[0], valid[n - 1], medianOfSorted(valid), n);
  }

  public static double mean(Collection<? extends Number> values) {
    double[] valid = toArray(validNumbers(values));
    return valid.length == 0 ? 0d : sum(valid) / valid.length;
  }

  /** Sample variance (n-1 denominator); zero for fewer than two finite values. */
  public static double variance(Collection<? extends Number> values) {
    double[] valid = toArray(validNumbers(values));
    if (valid.length <= 1) {
      return 0d;
    }
    double mean = sum(valid) / valid.length;
    return sumSquaredDeviations(valid, mean) / (valid.length - 1);
  }

  public static double standardDeviation(Collection<? extends Number> values) {
    return Math.sqrt(variance(values));
  }

  public static double median(Collection<? extends Number> values) {
    double[] valid = toSortedArray(validNumbers(values));
    return valid.length == 0 ? 0d : medianOfSorted(valid);
  }

  /**
   * Linear interpolation between order statistics of the finite subset of {@code values}.
   * {@code p} is clamped to [0, 100]; empty input or a NaN {@code p} yields 0.
   */
  public static double percentile(Collection<? extends Number> values, double p) {
    double[] sorted = toSortedArray(validNumbers(values));
    if (sorted.length == 0 || Double.isNaN(p)) {
      return 0d;
    }
    double clamped = Math.max(0d, Math.min(100d, p));
    double index = (clamped / 100d) * (sorted.length - 1);
    int lower = (int) Math.floor(index);
    int upper = (int) Math.ceil(index);
    if (lower == upper) {
      return sorted[lower];
    }
    return sorted[lower] + (sorted[upper] - sorted[lower]) * (index - lower);
  }

  public static IqrBounds iqrBounds(Collection<? extends Number> values) {
    return iqrBounds(values, 1.5);
  }

  public static IqrBounds iqrBounds(Collection<? extends Number> values, double multiplier) {
    if (values == null || values.isEmpty()) {
      return IqrBounds.EMPTY;
    }
    double q1 = percentile(values, 25);
    double q3 = percentile(values, 75);
    double iqr = q3 - q1;
    return new IqrBounds(q1, q3, iqr, q1 - multiplier * iqr, q3 + multiplier * iqr);
  }

  public static boolean isOutlier(double value, IqrBounds bounds) {
    return bounds.excludes(value);
  }

  public static List<Double> filterOutliers(Collection<? extends Number> values, double multiplier) {
    IqrBounds bounds = iqrBounds(values, multiplier);
    List<Double> out = new ArrayList<>();
    for (double v : validNumbers(values)) {
      if (!bounds.excludes(v)) {
        out.add(v);
      }
    }
    return out;
  }

  /**
   * Two-sided Mann-Whitney U test with mid-ranks for ties, tie-corrected variance and a
   * continuity-corrected normal approximation. The p-value is floored at 0.001.
   *
   * @throws IllegalArgumentException if either sample has no finite value
   */
  public static MannWhitneyResult mannWhitneyU(Collection<? extends Number> sample1,
      Collection<? extends Number> sample2) {
    List<Double> first = validNumbers(sample1);
    List<Double> second = validNumbers(sample2);
    if (first.isEmpty() || second.isEmpty()) {
      throw new IllegalArgumentException("Both samples must contain at least one value");
    }
    int n1 = first.size();
    int n2 = second.size();
    int total = n1 + n2;

    double[] values = new double[total];
    int[] groups = new int[total];
    int k = 0;
    for (double v : first) {
      values[k] = v;
      groups[k++] = 1;
    }
    for (double v : second) {
      values[k] = v;
      groups[k++] = 2;
    }
    Integer[] order = new Integer[total];
    for (int i = 0; i < total; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (a, b) -> Double.compare(values[a], values[b]));

    double r1 = 0d;
    double r2 = 0d;
    double tieCorrection = 0d;
    for (int i = 0; i < total; ) {
      int j = i;
      while (j < total && values[order[j]] == values[order[i]]) j++;
      double avgRank = (i + 1 + j) / 2d;
      for (int m = i; m < j; m++) {
        if (groups[order[m]] == 1) {
          r1 += avgRank;
        } else {
          r2 += avgRank;
        }
      }
      int ties = j - i;
      if (ties > 1) {
        tieCorrection += Math.pow(ties, 3) - ties;
      }
      i = j;
    }

    double u1 = r1 - (n1 * (n1 + 1)) / 2d;
    double u2 = r2 - (n2 * (n2 + 1)) / 2d;
    double u = Math.min(u1, u2);
    double meanU = (n1 * (double) n2) / 2d;
    double stdU = Math.sqrt((n1 * (double) n2 * (total + 1 - tieCorrection / (total * (double) (total - 1)))) / 12d);
    double z = stdU > 0 ? Math.abs(u - meanU - 0.5) / stdU : 0d;
    double p = Math.max(0.001, 2 * (1 - normalCdf(z)));
    return new MannWhitneyResult(u, u1, u2, z, p, r1, r2);
  }

  /**
   * Absolute Cohen's d with the pooled SD taken as the plain average of the two sample
   * variances.
   */
  public static EffectSize cohensD(Collection<? extends Number> data1, Collection<? extends Number> data2) {
    BasicStats s1 = basicStats(data1);
    BasicStats s2 = basicStats(data2);
    if (s1.count() <= 1 || s2.count() <= 1) {
      return new EffectSize(0d, EffectSize.INSUFFICIENT);
    }
    double pooledSd = Math.sqrt((s1.std() * s1.std() + s2.std() * s2.std()) / 2d);
    if (pooledSd <= EPSILON) {
      return new EffectSize(0d, EffectSize.NONE);
    }
    double value = Math.abs(s1.mean() - s2.mean()) / pooledSd;
    return new EffectSize(value, effectSizeLabel(value));
  }

  public static String effectSizeLabel(double cohensD) {
    if (cohensD < 0.2) return "Negligible";
    if (cohensD < 0.5) return "Small";
    if (cohensD < 0.8) return "Medium";
    return "Large";
  }

  /** Label for a correlation-style effect size r. */
  public static String effectSizeLabelR(double r) {
    if (r < 0.1) return "Negligible";
    if (r < 0.3) return "Small";
    if (r < 0.5) return "Medium";
    return "Large";
  }

  public static String asteriskNotation(double pValue) {
    if (pValue < 0.001) return "***";
    if (pValue < 0.01) return "**";
    if (pValue < 0.05) return "*";
    return "";
  }

  public static double normalCdf(double z) {
    return 0.5 * (1 + erf(z / Math.sqrt(2)));
  }

  /** Abramowitz and Stegun 7.1.26; absolute error below 1.5e-7. */
  public static double erf(double x) {
    double sign = x >= 0 ? 1 : -1;
    double ax = Math.abs(x);
    double t = 1.0 / (1.0 + ERF_P * ax);
    double y = 1.0 - (((((ERF_A5 * t + ERF_A4) * t) + ERF_A3) * t + ERF_A2) * t + ERF_A1) * t * Math.exp(-ax * ax);
    return sign * y;
  }

  /** Groups items by key, keeping first-seen key order and insertion order within a group. */
  public static <T, K> Map<K, List<T>> groupBy(Collection<T> items, Function<? super T, ? extends K> keyFn) {
    Map<K, List<T>> groups = new LinkedHashMap<>();
    if (items == null) {
      return groups;
    }
    for (T item : items) {
      groups.computeIfAbsent(keyFn.apply(item), key -> new ArrayList<>()).add(item);
    }
    return groups;
  }

  /**
   * Instantaneous growth rate {@code ln(vy / vx) / (ty - tx)}; NaN unless both values are
   * strictly positive and {@code ty > tx}.
   */
  public static double tumorGrowthRate(double valueX, double valueY, double timeX, double timeY) {
    if (!(valueX > 0) || !(valueY > 0) || !(timeY > timeX)) {
      return Double.NaN;
    }
    return Math.log(valueY / valueX) / (timeY - timeX);
  }

  private static double[] toArray(List<Double> values) {
    double[] out = new double[values.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = values.get(i);
    }
    return out;
  }

  private static double[] toSortedArray(List<Double> values) {
    double[] out = toArray(values);
    Arrays.sort(out);
    return out;
  }

  private static double sum(double[] values) {
    double sum = 0d;
    for (double v : values) {
      sum += v;
    }
    return sum;
  }

  private static double sumSquaredDeviations(double[] values, double mean) {
    double acc = 0d;
    for (double v : values) {
      double d = v - mean;
      acc += d * d;
    }
    return acc;
  }

  private static double medianOfSorted(double[] sorted) {
    int n = sorted.length;
    return n % 2 == 0 ? (sorted[n / 2 - 1] + sorted[n / 2]) / 2d : sorted[n / 2];
  }
}
