package com.ospicorp.tumorgrowth.outlier.service;

import com.ospicorp.tumorgrowth.outlier.model.AnnotatedAnimal;
import com.ospicorp.tumorgrowth.outlier.model.DatasetView;
import com.ospicorp.tumorgrowth.outlier.model.Decision;
import com.ospicorp.tumorgrowth.outlier.model.DualAnalysis;
import com.ospicorp.tumorgrowth.outlier.model.ExcludedPoint;
import com.ospicorp.tumorgrowth.outlier.model.FilteringImpact;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import com.ospicorp.tumorgrowth.outlier.model.Flag;
import com.ospicorp.tumorgrowth.outlier.model.PointFilteredAnimal;
import com.ospicorp.tumorgrowth.outlier.model.PointFilteringAnalysis;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the whole-animal and per-point filtered views from a decision list. Every EXCLUDE
 * decision is checked again against the strictness before it removes anything, so decisions
 * derived under another strictness cannot leak into the views.
 */
public final class DatasetViews {

  static final int MIN_POINTS_PER_ANIMAL = 3;
  static final String POINT_REASON = "Automatic filtering";

  private DatasetViews() {}

  public static DualAnalysis dual(List<AnnotatedAnimal> animals, List<Flag> flags, List<Decision> decisions,
      FilteringStrictness strictness) {
    Set<String> excludedIds = new LinkedHashSet<>();
    for (Decision decision : decisions) {
      if (applies(decision, flags, strictness)) {
        excludedIds.add(decision.animalId());
      }
    }

    List<AnnotatedAnimal> kept = new ArrayList<>();
    List<String> removedIds = new ArrayList<>();
    int removedMeasurements = 0;
    for (AnnotatedAnimal animal : animals) {
      if (excludedIds.contains(animal.id())) {
        removedIds.add(animal.id());
        removedMeasurements += animal.measurements().size();
      } else {
        kept.add(animal);
      }
    }

    DatasetView complete = DatasetView.of(animals);
    DatasetView filtered = DatasetView.of(kept);
    FilteringImpact impact = new FilteringImpact(complete.count() - filtered.count(), removedMeasurements,
        List.copyOf(removedIds));
    return new DualAnalysis(complete, filtered, impact);
  }

  /**
   * Per-point view. Animals left with fewer than three points leave the view together with
   * their excluded points, so {@code excludedPoints} counts retained animals only.
   */
  public static PointFilteringAnalysis pointFiltered(List<AnnotatedAnimal> animals, List<Flag> flags,
      List<Decision> decisions, FilteringStrictness strictness) {
    List<PointFilteredAnimal> out = new ArrayList<>();
    int original = 0;
    int excluded = 0;
    int remaining = 0;
    for (AnnotatedAnimal animal : animals) {
      int n = Math.min(animal.timePoints().size(), animal.measurements().size());
      original += n;

      Set<Integer> drop = new TreeSet<>();
      for (Decision decision : decisions) {
        if (!Objects.equals(decision.animalId(), animal.id()) || decision.day() == 0d
            || !applies(decision, flags, strictness)) {
          continue;
        }
        int idx = indexOfDay(animal, decision.day(), n);
        if (idx >= 0) {
          drop.add(idx);
        }
      }

      List<Double> days = new ArrayList<>();
      List<Double> values = new ArrayList<>();
      List<ExcludedPoint> excludedPoints = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        if (drop.contains(i)) {
          excludedPoints.add(new ExcludedPoint(animal.timePoints().get(i), animal.measurements().get(i),
              POINT_REASON));
        } else {
          days.add(animal.timePoints().get(i));
          values.add(animal.measurements().get(i));
        }
      }
      if (values.size() >= MIN_POINTS_PER_ANIMAL) {
        excluded += excludedPoints.size();
        remaining += values.size();
        out.add(new PointFilteredAnimal(animal.id(), animal.group(), days, values, excludedPoints));
      }
    }
    return new PointFilteringAnalysis(List.copyOf(out), excluded, original, remaining);
  }

  /** True when the decision is EXCLUDE and the flag it refers to still meets the strictness. */
  static boolean applies(Decision decision, List<Flag> flags, FilteringStrictness strictness) {
    if (!decision.isExclude()) {
      return false;
    }
    Flag flag = flagFor(decision, flags);
    return flag != null && strictness.excludes(flag.severity());
  }

  /**
   * The flag a decision was made for: the one at {@code flagId} when it matches the decision's
   * animal and day, otherwise the first flag at that animal and day.
   */
  static Flag flagFor(Decision decision, List<Flag> flags) {
    int id = decision.flagId();
    if (id >= 0 && id < flags.size() && matches(flags.get(id), decision)) {
      return flags.get(id);
    }
    return flags.stream().filter(f -> matches(f, decision)).findFirst().orElse(null);
  }

  private static boolean matches(Flag flag, Decision decision) {
    return Objects.equals(flag.animalId(), decision.animalId()) && flag.day() == decision.day();
  }

  private static int indexOfDay(AnnotatedAnimal animal, double day, int n) {
    for (int i = 0; i < n; i++) {
      Double t = animal.timePoints().get(i);
      if (t != null && t == day) {
        return i;
      }
    }
    return -1;
  }
}
