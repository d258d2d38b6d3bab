package com.ospicorp.tumorgrowth.outlier.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.outlier.model.Flag;
import com.ospicorp.tumorgrowth.outlier.model.FlagType;
import com.ospicorp.tumorgrowth.outlier.model.ProfilePreset;
import com.ospicorp.tumorgrowth.outlier.model.SensitivityProfile;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyDetectorTest {

  private static final SensitivityProfile CONSERVATIVE = ProfilePreset.CONSERVATIVE.profile().orElseThrow();
  private static final SensitivityProfile MODERATE = ProfilePreset.MODERATE.profile().orElseThrow();
  private static final SensitivityProfile ULTRA = ProfilePreset.ULTRA_CONSERVATIVE.profile().orElseThrow();

  @Test
  void baselineIsNeverFlaggedAsOutlier() {
    var spiky = animal("S1", "G", List.of(0d, 7d, 14d), List.of(5d, 500d, 6d));

    for (ProfilePreset preset : List.of(ProfilePreset.ULTRA_CONSERVATIVE, ProfilePreset.CONSERVATIVE,
        ProfilePreset.MODERATE)) {
      var scan = AnomalyDetector.detect(List.of(spiky), preset.profile().orElseThrow());
      assertTrue(scan.flags().stream().noneMatch(f -> f.day() == 0d), preset.code());
    }
  }

  @Test
  void extremeBaselineInGroupIsNotAGroupOutlier() {
    List<AnimalRecord> group = new ArrayList<>();
    double[] baselines = {100, 100, 100, 100, 5000};
    for (int i = 0; i < baselines.length; i++) {
      group.add(animal("B" + i, "G", List.of(0d, 7d), List.of(baselines[i], 100d + i)));
    }

    var scan = AnomalyDetector.detect(group, MODERATE);

    assertTrue(scan.flags().stream().noneMatch(f -> f.type() == FlagType.GROUP_OUTLIER && f.day() == 0d));
  }

  @Test
  void nonPositiveValueIsImpossible() {
    var scan = AnomalyDetector.detect(List.of(animal("M1", "G", List.of(0d, 7d, 14d), List.of(100d, 0d, 120d))),
        CONSERVATIVE);

    assertEquals(List.of(FlagType.IMPOSSIBLE_VALUE), types(scan.flags()));
    assertEquals(7d, scan.flags().get(0).day());
  }

  @Test
  void rapidRiseIsExtremeGrowth() {
    var scan = AnomalyDetector.detect(
        List.of(animal("M1", "G", List.of(0d, 1d, 2d, 3d), List.of(100d, 110d, 5000d, 5200d))), CONSERVATIVE);

    assertEquals(List.of(FlagType.EXTREME_GROWTH), types(scan.flags()));
    assertEquals(2d, scan.flags().get(0).day());
  }

  @Test
  void rapidFallIsExtremeDecline() {
    var scan = AnomalyDetector.detect(
        List.of(animal("M1", "G", List.of(0d, 1d, 2d, 3d), List.of(1000d, 1100d, 100d, 120d))), CONSERVATIVE);

    assertEquals(List.of(FlagType.EXTREME_DECLINE), types(scan.flags()));
  }

  @Test
  void lastValueBelowHalfOfPreviousIsLastDayDrop() {
    var scan = AnomalyDetector.detect(
        List.of(animal("M1", "G", List.of(0d, 7d, 14d, 21d), List.of(100d, 150d, 200d, 90d))), CONSERVATIVE);

    assertEquals(List.of(FlagType.LAST_DAY_DROP), types(scan.flags()));
    assertEquals(21d, scan.flags().get(0).day());
  }

  @Test
  void spikeOutsideOwnLogRangeIsIntraAnimalOutlier() {
    var animal = animal("M1", "G", List.of(0d, 3d, 6d, 9d, 12d, 15d),
        List.of(100d, 110d, 1000d, 120d, 130d, 140d));

    var annotated = AnomalyDetector.scanAnimal(animal, MODERATE);

    assertEquals(List.of(FlagType.INTRA_ANIMAL_OUTLIER), types(annotated.flags()));
    assertEquals(1, annotated.flaggedMeasurements().size());
    assertEquals(2, annotated.flaggedMeasurements().get(0).index());
    assertEquals(6d, annotated.flaggedMeasurements().get(0).day());
  }

  @Test
  void animalFarFromGroupOnSameDayIsGroupOutlier() {
    var scan = AnomalyDetector.detect(outlierGroup(), MODERATE);

    assertEquals(List.of(FlagType.GROUP_OUTLIER), types(scan.flags()));
    Flag flag = scan.flags().get(0);
    assertEquals("A5", flag.animalId());
    assertEquals(7d, flag.day());
    assertEquals(1000d, flag.value());
  }

  @Test
  void smallGroupsAreSkippedAndLogged() {
    var scan = AnomalyDetector.detect(outlierGroup(), ULTRA);

    assertTrue(scan.flags().isEmpty());
    assertTrue(scan.log().contains("Group G skipped (n=5)"));
  }

  @Test
  void perAnimalFlagsComeBeforeGroupFlags() {
    List<AnimalRecord> animals = new ArrayList<>(outlierGroup());
    animals.add(animal("Z1", "Other", List.of(0d, 7d, 14d), List.of(100d, -1d, 120d)));

    var scan = AnomalyDetector.detect(animals, MODERATE);

    assertEquals(List.of(FlagType.IMPOSSIBLE_VALUE, FlagType.GROUP_OUTLIER), types(scan.flags()));
  }

  @Test
  void missingAndNonFiniteMeasurementsAreTreatedAsAbsent() {
    var animal = animal("M1", "G", List.of(0d, 7d, 14d, 21d), Arrays.asList(100d, null, Double.NaN, 120d));
    var noDays = new AnimalRecord("M2", null, null, null);

    var scan = AnomalyDetector.detect(List.of(animal, noDays), CONSERVATIVE);

    assertTrue(scan.flags().isEmpty());
    assertEquals(2, scan.animals().size());
  }

  @Test
  void emptyDatasetHasNoFlags() {
    var scan = AnomalyDetector.detect(List.of(), CONSERVATIVE);
    assertTrue(scan.flags().isEmpty());
    assertTrue(scan.animals().isEmpty());
  }

  @Test
  void flagCarriesSeverityOfItsType() {
    var flag = Flag.of(FlagType.INTRA_ANIMAL_OUTLIER, "M1", "G", 14d, 80d);
    assertEquals(FlagType.INTRA_ANIMAL_OUTLIER.severity(), flag.severity());
    assertEquals("Intra-Animal Outlier at day 14", flag.message());
  }

  static List<AnimalRecord> outlierGroup() {
    double[] day7 = {100, 105, 110, 95, 1000};
    List<AnimalRecord> group = new ArrayList<>();
    for (int i = 0; i < day7.length; i++) {
      group.add(animal("A" + (i + 1), "G", List.of(0d, 7d), List.of(100d, day7[i])));
    }
    return group;
  }

  static AnimalRecord animal(String id, String group, List<Double> days, List<Double> values) {
    return new AnimalRecord(id, group, days, values);
  }

  private static List<FlagType> types(List<Flag> flags) {
    return flags.stream().map(Flag::type).toList();
  }
}
