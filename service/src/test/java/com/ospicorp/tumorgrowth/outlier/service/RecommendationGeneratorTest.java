package com.ospicorp.tumorgrowth.outlier.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tumorgrowth.model.RecommendationLevel;
import com.ospicorp.tumorgrowth.outlier.model.DatasetView;
import com.ospicorp.tumorgrowth.outlier.model.DualAnalysis;
import com.ospicorp.tumorgrowth.outlier.model.FilteringImpact;
import com.ospicorp.tumorgrowth.outlier.model.Flag;
import com.ospicorp.tumorgrowth.outlier.model.FlagType;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecommendationGeneratorTest {

  @Test
  void repeatedLastDayDropsRaiseTemporalWarning() {
    var flags = List.of(
        Flag.of(FlagType.LAST_DAY_DROP, "M1", "G", 21d, 40d),
        Flag.of(FlagType.LAST_DAY_DROP, "M2", "G", 21d, 35d),
        Flag.of(FlagType.LAST_DAY_DROP, "M3", "G", 21d, 30d));

    var recs = RecommendationGenerator.specific(flags);

    assertEquals(1, recs.size());
    assertEquals(RecommendationLevel.WARNING, recs.get(0).type());
    assertEquals("temporal", recs.get(0).category());
    assertEquals("Detected 3 drops", recs.get(0).message());
    assertEquals(List.of("M1", "M2", "M3"), recs.get(0).affectedAnimals());
  }

  @Test
  void declineCategoryDependsOnAffectedAnimals() {
    var single = RecommendationGenerator.specific(List.of(
        Flag.of(FlagType.EXTREME_DECLINE, "M1", "G", 7d, 10d),
        Flag.of(FlagType.EXTREME_DECLINE, "M1", "G", 14d, 2d)));
    var several = RecommendationGenerator.specific(List.of(
        Flag.of(FlagType.EXTREME_DECLINE, "M1", "G", 7d, 10d),
        Flag.of(FlagType.EXTREME_DECLINE, "M2", "G", 7d, 12d)));

    assertEquals("individual", single.get(0).category());
    assertEquals(List.of("M1"), single.get(0).affectedAnimals());
    assertEquals("systematic", several.get(0).category());
  }

  @Test
  void repeatedExtremeGrowthSuggestsCalibration() {
    var recs = RecommendationGenerator.specific(List.of(
        Flag.of(FlagType.EXTREME_GROWTH, "M1", "G", 7d, 900d),
        Flag.of(FlagType.EXTREME_GROWTH, "M2", "G", 7d, 950d)));

    assertEquals(RecommendationLevel.INFO, recs.get(0).type());
    assertEquals("biological", recs.get(0).category());
    assertEquals("Review instrument calibration", recs.get(0).action());
  }

  @Test
  void singleFlagsDoNotTriggerSpecificAdvice() {
    assertTrue(RecommendationGenerator.specific(List.of(
        Flag.of(FlagType.EXTREME_GROWTH, "M1", "G", 7d, 900d),
        Flag.of(FlagType.LAST_DAY_DROP, "M2", "G", 21d, 35d))).isEmpty());
  }

  @Test
  void generalAdviceReflectsImpact() {
    var view = new DatasetView(List.of(), 0, 0);
    var dual = new DualAnalysis(view, view, new FilteringImpact(2, 8, List.of("M1", "M2")));

    var recs = RecommendationGenerator.general(dual, List.of(Flag.of(FlagType.EXTREME_GROWTH, "M1", "G", 7d, 9d)));

    assertEquals(List.of("Excluded Animals", "Filtering Impact"), recs.stream().map(r -> r.title()).toList());
    assertEquals("Review 2 excluded animals.", recs.get(0).message());
    assertEquals("8 measurements affected.", recs.get(1).message());
  }

  @Test
  void cleanDatasetGetsSuccessMessage() {
    var view = new DatasetView(List.of(), 0, 0);
    var dual = new DualAnalysis(view, view, new FilteringImpact(0, 0, List.of()));

    var recs = RecommendationGenerator.general(dual, List.of(Flag.of(FlagType.GROUP_OUTLIER, "M1", "G", 7d, 9d)));

    assertEquals(1, recs.size());
    assertEquals(RecommendationLevel.SUCCESS, recs.get(0).type());
    assertEquals("No critical anomalies detected.", recs.get(0).message());
  }
}
