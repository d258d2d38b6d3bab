package com.ospicorp.tumorgrowth.outlier.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tumorgrowth.batch.ChunkedExecutor;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.model.RecommendationLevel;
import com.ospicorp.tumorgrowth.outlier.model.DataType;
import com.ospicorp.tumorgrowth.outlier.model.DecisionType;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import com.ospicorp.tumorgrowth.outlier.model.ProfilePreset;
import com.ospicorp.tumorgrowth.outlier.model.SensitivityProfile;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OutlierAnalysisServiceTest {

  private static final SensitivityProfile MODERATE = ProfilePreset.MODERATE.profile().orElseThrow();

  private ExecutorService pool;
  private OutlierAnalysisService service;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(3);
    service = new OutlierAnalysisService(new ChunkedExecutor(pool, Duration.ofSeconds(10), 3),
        "conservative", "criticalAndHigh", 10, 3);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void analysisCombinesFlagsDecisionsAndViews() {
    List<AnimalRecord> animals = new ArrayList<>(AnomalyDetectorTest.outlierGroup());
    animals.add(new AnimalRecord("Z1", "Other", List.of(0d, 7d, 14d, 21d), List.of(100d, -5d, 120d, 140d)));

    var result = service.analyzeDataset(animals, MODERATE, FilteringStrictness.ALL, DataType.BLI);

    assertEquals(2, result.flags().size());
    assertEquals(2, result.decisions().size());
    assertTrue(result.decisions().stream().allMatch(d -> d.decision() == DecisionType.EXCLUDE));
    assertEquals(List.of("A5", "Z1"), result.dualAnalysis().impact().excludedAnimalIds());
    assertEquals(4, result.dualAnalysis().filtered().count());
    assertEquals(DataType.BLI, result.dataType());
    assertEquals(FilteringStrictness.ALL, result.filteringStrictness());

    var summary = result.summary();
    assertEquals(2, summary.totalFlags());
    assertEquals(1, summary.flagCounts().get("IMPOSSIBLE_VALUE"));
    assertEquals(1, summary.flagCounts().get("GROUP_OUTLIER"));
    assertEquals(0, summary.flagCounts().get("LAST_DAY_DROP"));
    assertEquals(1, summary.severityCounts().get("critical"));
    assertEquals(1, summary.severityCounts().get("medium"));
    assertEquals(0, summary.severityCounts().get("low"));
    assertEquals(2, summary.decisionCounts().get("EXCLUDE"));
    assertEquals(0, summary.decisionCounts().get("INCLUDE"));
    assertEquals(MODERATE.name(), summary.configUsed());

    // Z1 keeps three points; A5 keeps only its baseline and its excluded point leaves with it
    assertEquals(1, result.pointFilteringAnalysis().excludedPoints());
    assertTrue(result.pointFilteringAnalysis().animals().stream().anyMatch(a -> a.id().equals("Z1")));
    assertTrue(result.pointFilteringAnalysis().animals().stream().noneMatch(a -> a.id().equals("A5")));
    assertEquals(RecommendationLevel.WARNING, result.recommendations().get(0).type());
  }

  @Test
  void emptyDatasetYieldsEmptySummary() {
    var result = service.analyzeDataset(List.of(), DataType.VOLUME);

    assertTrue(result.flags().isEmpty());
    assertEquals(0, result.summary().totalFlags());
    assertEquals(0, result.dualAnalysis().complete().count());
    assertEquals(ProfilePreset.CONSERVATIVE.profile().orElseThrow().name(), result.summary().configUsed());
    assertEquals("Data Quality", result.recommendations().get(0).title());
  }

  @Test
  void parallelScanMatchesSequentialScan() {
    List<AnimalRecord> animals = new ArrayList<>();
    for (int g = 0; g < 4; g++) {
      for (int i = 0; i < 6; i++) {
        double spike = i == 5 ? 20 : 1;
        animals.add(new AnimalRecord("G" + g + "A" + i, "G" + g, List.of(0d, 7d, 14d, 21d),
            List.of(100d, 120d * spike, 150d + i, i == 2 ? 40d : 160d)));
      }
    }
    animals.add(null);

    var parallel = service.detect(animals, MODERATE);
    var sequential = AnomalyDetector.detect(animals.subList(0, 24), MODERATE);

    assertEquals(sequential.flags(), parallel.flags());
    assertEquals(24, parallel.animals().size());
    assertFalse(parallel.flags().isEmpty());
  }

  @Test
  void redecideReusesFlagsUnderNewStrictness() {
    var result = service.analyzeDataset(
        new ArrayList<>(AnomalyDetectorTest.outlierGroup()), MODERATE, FilteringStrictness.CRITICAL, null);
    assertEquals(DecisionType.INCLUDE, result.decisions().get(0).decision());
    assertEquals(DataType.VOLUME, result.dataType());

    var redecided = service.redecide(result.flags(), FilteringStrictness.ALL);

    assertEquals(DecisionType.EXCLUDE, redecided.get(0).decision());
  }

  @Test
  void profileResolutionPrefersCustomThenNamedThenDefault() {
    var custom = new SensitivityProfile("Custom", 1.0, 1.0, 1.5, false, 3, null);
    var animals = Arrays.asList(new AnimalRecord("M1", "G", List.of(0d), List.of(1d)), null);

    assertSame(custom, service.resolveProfile("moderate", custom, animals));
    assertEquals(MODERATE, service.resolveProfile("moderate", null, animals));
    assertEquals(ProfilePreset.CONSERVATIVE.profile().orElseThrow(), service.resolveProfile(null, null, animals));
    assertEquals(ProfilePreset.ULTRA_CONSERVATIVE.profile().orElseThrow(),
        service.resolveProfile("auto", null, animals));
  }
}
