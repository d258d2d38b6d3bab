package com.ospicorp.tumorgrowth.outlier.service;

import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.outlier.model.AnnotatedAnimal;
import com.ospicorp.tumorgrowth.outlier.model.AnomalyScan;
import com.ospicorp.tumorgrowth.outlier.model.Flag;
import com.ospicorp.tumorgrowth.outlier.model.FlagType;
import com.ospicorp.tumorgrowth.outlier.model.FlaggedMeasurement;
import com.ospicorp.tumorgrowth.outlier.model.SensitivityProfile;
import com.ospicorp.tumorgrowth.stats.IqrBounds;
import com.ospicorp.tumorgrowth.stats.Statistics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flags suspicious measurements. Output depends only on the animals and the profile; no state
 * is kept between calls.
 */
public final class AnomalyDetector {

  /** Minimum number of positive measurements for the log-space IQR tests. */
  static final int MIN_IQR_POINTS = 4;
  /** Minimum number of animals measured on a day for the group IQR test. */
  static final int MIN_GROUP_DAY_POINTS = 3;
  static final double LAST_DAY_DROP_RATIO = 0.5;

  private AnomalyDetector() {}

  public static AnomalyScan detect(List<AnimalRecord> animals, SensitivityProfile profile) {
    List<AnnotatedAnimal> annotated = new ArrayList<>(animals.size());
    for (AnimalRecord animal : animals) {
      annotated.add(scanAnimal(animal, profile));
    }
    return combine(animals, annotated, profile);
  }

  /**
   * Runs the group scan over {@code animals} and merges its flags after the per-animal flags
   * already present on {@code annotated}, which must be in the same order as {@code animals}.
   */
  public static AnomalyScan combine(List<AnimalRecord> animals, List<AnnotatedAnimal> annotated,
      SensitivityProfile profile) {
    List<Flag> flags = new ArrayList<>();
    for (AnnotatedAnimal a : annotated) {
      flags.addAll(a.flags());
    }
    List<String> log = new ArrayList<>();
    Map<String, List<AnimalRecord>> groups = Statistics.groupBy(animals, AnimalRecord::groupKey);
    for (Map.Entry<String, List<AnimalRecord>> e : groups.entrySet()) {
      int size = e.getValue().size();
      if (size < profile.minGroupSizeForIQR()) {
        log.add("Group " + e.getKey() + " skipped (n=" + size + ")");
        continue;
      }
      flags.addAll(scanGroup(e.getKey(), e.getValue(), profile));
    }
    log.add("Detected " + flags.size() + " flag(s) in " + animals.size() + " animal(s) using "
        + profile.name());
    return new AnomalyScan(List.copyOf(annotated), List.copyOf(flags), List.copyOf(log));
  }

  public static AnnotatedAnimal scanAnimal(AnimalRecord animal, SensitivityProfile profile) {
    List<Double> days = animal.timePoints();
    List<Double> values = animal.measurements();
    int n = animal.pairCount();
    List<Flag> flags = new ArrayList<>();
    Map<Integer, FlaggedMeasurement> flagged = new LinkedHashMap<>();

    for (int i = 0; i < n; i++) {
      Double value = values.get(i);
      Double day = days.get(i);
      if (!AnimalRecord.isFinite(value) || !AnimalRecord.isFinite(day)) {
        continue;
      }
      List<Flag> pointFlags = new ArrayList<>();
      if (value <= 0) {
        pointFlags.add(flag(FlagType.IMPOSSIBLE_VALUE, animal, day, value));
      }

      Double prev = i > 0 ? values.get(i - 1) : null;
      Double prevDay = i > 0 ? days.get(i - 1) : null;
      if (AnimalRecord.isPositive(prev) && AnimalRecord.isFinite(prevDay) && value > 0 && day > prevDay) {
        double rate = Statistics.tumorGrowthRate(prev, value, prevDay, day);
        if (!Double.isNaN(rate)) {
          if (value > prev && Math.abs(rate) > profile.maxGrowthRate()) {
            pointFlags.add(flag(FlagType.EXTREME_GROWTH, animal, day, value));
          } else if (value < prev && Math.abs(rate) > profile.maxDeclineRate()) {
            pointFlags.add(flag(FlagType.EXTREME_DECLINE, animal, day, value));
          }
        }
      }

      if (i == n - 1 && i > 0 && AnimalRecord.isFinite(prev) && value < prev * LAST_DAY_DROP_RATIO) {
        pointFlags.add(flag(FlagType.LAST_DAY_DROP, animal, day, value));
      }

      if (!pointFlags.isEmpty()) {
        flags.addAll(pointFlags);
        flagged.put(i, new FlaggedMeasurement(i, day, value, pointFlags));
      }
    }

    for (int i : intraAnimalOutliers(animal, profile)) {
      Flag flag = flag(FlagType.INTRA_ANIMAL_OUTLIER, animal, days.get(i), values.get(i));
      flags.add(flag);
      FlaggedMeasurement existing = flagged.get(i);
      List<Flag> merged = new ArrayList<>();
      if (existing != null) {
        merged.addAll(existing.flags());
      }
      merged.add(flag);
      flagged.put(i, new FlaggedMeasurement(i, days.get(i), values.get(i), List.copyOf(merged)));
    }

    List<FlaggedMeasurement> ordered = new ArrayList<>(new TreeMap<>(flagged).values());
    return AnnotatedAnimal.of(animal, flags, ordered);
  }

  /** Indices of positive measurements that fall outside the animal's own log-space IQR bounds. */
  static List<Integer> intraAnimalOutliers(AnimalRecord animal, SensitivityProfile profile) {
    int n = animal.pairCount();
    if (n < MIN_IQR_POINTS) {
      return List.of();
    }
    List<Double> logs = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      Double value = animal.measurements().get(i);
      if (AnimalRecord.isPositive(value)) {
        logs.add(Math.log(value));
      }
    }
    if (logs.size() < MIN_IQR_POINTS) {
      return List.of();
    }
    IqrBounds bounds = Statistics.iqrBounds(logs, profile.iqrSensitivity());
    List<Integer> out = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      Double value = animal.measurements().get(i);
      Double day = animal.timePoints().get(i);
      if (AnimalRecord.isPositive(value) && AnimalRecord.isFinite(day) && day != 0d
          && bounds.excludes(Math.log(value))) {
        out.add(i);
      }
    }
    return out;
  }

  /** Group-level log-space IQR test per day. Callers skip groups smaller than the profile minimum. */
  public static List<Flag> scanGroup(String group, List<AnimalRecord> members, SensitivityProfile profile) {
    TreeMap<Double, List<Double>> logsByDay = new TreeMap<>();
    for (AnimalRecord animal : members) {
      int n = animal.pairCount();
      for (int i = 0; i < n; i++) {
        Double value = animal.measurements().get(i);
        Double day = animal.timePoints().get(i);
        if (AnimalRecord.isPositive(value) && AnimalRecord.isFinite(day)) {
          logsByDay.computeIfAbsent(day, d -> new ArrayList<>()).add(Math.log(value));
        }
      }
    }

    List<Flag> flags = new ArrayList<>();
    for (Map.Entry<Double, List<Double>> e : logsByDay.entrySet()) {
      double day = e.getKey();
      if (e.getValue().size() < MIN_GROUP_DAY_POINTS || day == 0d) {
        continue;
      }
      IqrBounds bounds = Statistics.iqrBounds(e.getValue(), profile.iqrSensitivity());
      for (AnimalRecord animal : members) {
        int idx = animal.indexOfDay(day);
        if (idx < 0) {
          continue;
        }
        Double value = animal.measurements().get(idx);
        if (AnimalRecord.isPositive(value) && bounds.excludes(Math.log(value))) {
          flags.add(flag(FlagType.GROUP_OUTLIER, animal, day, value));
        }
      }
    }
    return flags;
  }

  private static Flag flag(FlagType type, AnimalRecord animal, double day, Double value) {
    return Flag.of(type, animal.id(), animal.groupKey(), day, value);
  }
}
