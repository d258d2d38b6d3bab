package com.ospicorp.tumorgrowth.outlier.service;

import com.ospicorp.tumorgrowth.batch.ChunkedExecutor;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.outlier.model.AnalysisResult;
import com.ospicorp.tumorgrowth.outlier.model.AnalysisSummary;
import com.ospicorp.tumorgrowth.outlier.model.AnnotatedAnimal;
import com.ospicorp.tumorgrowth.outlier.model.AnomalyScan;
import com.ospicorp.tumorgrowth.outlier.model.DataType;
import com.ospicorp.tumorgrowth.outlier.model.Decision;
import com.ospicorp.tumorgrowth.outlier.model.DualAnalysis;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import com.ospicorp.tumorgrowth.outlier.model.Flag;
import com.ospicorp.tumorgrowth.outlier.model.PointFilteringAnalysis;
import com.ospicorp.tumorgrowth.outlier.model.ProfilePreset;
import com.ospicorp.tumorgrowth.outlier.model.SensitivityProfile;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs the two analysis phases: detection, a function of animals and profile, and evaluation,
 * a function of the flags and the filtering strictness. Holds configuration only, so concurrent
 * calls are safe.
 */
@Service
public class OutlierAnalysisService {
  private static final Logger log = LoggerFactory.getLogger(OutlierAnalysisService.class);

  private final ChunkedExecutor chunkedExecutor;
  private final ProfilePreset defaultPreset;
  private final FilteringStrictness defaultStrictness;
  private final int parallelThreshold;
  private final int workers;

  public OutlierAnalysisService(ChunkedExecutor chunkedExecutor,
      @Value("${tumorgrowth.outlier.default-profile:conservative}") String defaultProfile,
      @Value("${tumorgrowth.outlier.filtering-strictness:criticalAndHigh}") String defaultStrictness,
      @Value("${tumorgrowth.batch.parallel-threshold:10}") int parallelThreshold,
      @Value("${tumorgrowth.batch.workers:4}") int workers) {
    this.chunkedExecutor = chunkedExecutor;
    this.defaultPreset = ProfilePreset.fromCode(defaultProfile);
    this.defaultStrictness = FilteringStrictness.fromCode(defaultStrictness);
    this.parallelThreshold = parallelThreshold;
    this.workers = Math.max(1, workers);
  }

  public ProfilePreset defaultPreset() {
    return defaultPreset;
  }

  public FilteringStrictness defaultStrictness() {
    return defaultStrictness;
  }

  /**
   * Profile for a request: a custom profile wins, then the named preset, then the configured
   * default. Unknown names fall back to the conservative preset.
   */
  public SensitivityProfile resolveProfile(String name, SensitivityProfile custom, List<AnimalRecord> animals) {
    if (custom != null) {
      return custom;
    }
    ProfilePreset preset = name == null || name.isBlank() ? defaultPreset : ProfilePreset.fromCode(name);
    return preset.resolve(nonNull(animals));
  }

  public AnalysisResult analyzeDataset(List<AnimalRecord> animals, DataType dataType) {
    List<AnimalRecord> input = nonNull(animals);
    return analyzeDataset(input, defaultPreset.resolve(input), defaultStrictness, dataType);
  }

  public AnalysisResult analyzeDataset(List<AnimalRecord> animals, SensitivityProfile profile,
      FilteringStrictness strictness, DataType dataType) {
    AnomalyScan scan = detect(animals, profile);
    return evaluate(scan, profile, strictness == null ? defaultStrictness : strictness, dataType);
  }

  /** Detection phase. Large datasets are scanned per animal on the analysis executor. */
  public AnomalyScan detect(List<AnimalRecord> animals, SensitivityProfile profile) {
    Objects.requireNonNull(profile, "profile");
    List<AnimalRecord> input = nonNull(animals);
    if (input.size() <= parallelThreshold) {
      return AnomalyDetector.detect(input, profile);
    }
    int chunkSize = (input.size() + workers - 1) / workers;
    List<AnnotatedAnimal> annotated = chunkedExecutor.map(input, chunkSize, (index, total, chunk) -> {
      List<AnnotatedAnimal> out = new ArrayList<>(chunk.size());
      for (AnimalRecord animal : chunk) {
        out.add(AnomalyDetector.scanAnimal(animal, profile));
      }
      log.debug("Scanned chunk {}/{} ({} animal(s))", index + 1, total, chunk.size());
      return out;
    });
    return AnomalyDetector.combine(input, annotated, profile);
  }

  /** Evaluation phase: decisions, both filtered views, summary and recommendations. */
  public AnalysisResult evaluate(AnomalyScan scan, SensitivityProfile profile, FilteringStrictness strictness,
      DataType dataType) {
    List<Flag> flags = scan.flags();
    List<Decision> decisions = DecisionEngine.decide(flags, strictness);
    DualAnalysis dual = DatasetViews.dual(scan.animals(), flags, decisions, strictness);
    PointFilteringAnalysis points = DatasetViews.pointFiltered(scan.animals(), flags, decisions, strictness);
    AnalysisSummary summary = AnalysisSummary.of(flags, decisions, profile);

    List<String> runLog = new ArrayList<>(scan.log());
    runLog.add("Excluded " + dual.impact().animalsExcluded() + " animal(s) and " + points.excludedPoints()
        + " point(s) with strictness " + strictness.code());
    log.info("Outlier analysis: {} animal(s), {} flag(s), {} excluded animal(s), {} excluded point(s) [{}]",
        scan.animals().size(), flags.size(), dual.impact().animalsExcluded(), points.excludedPoints(),
        profile.name());
    scan.log().forEach(line -> log.debug(line));

    return new AnalysisResult(scan.animals(), flags, decisions, dual, points, summary,
        RecommendationGenerator.general(dual, flags), RecommendationGenerator.specific(flags),
        strictness, dataType == null ? DataType.VOLUME : dataType, List.copyOf(runLog));
  }

  /** Decisions for existing flags under another strictness; the animals are not rescanned. */
  public List<Decision> redecide(List<Flag> flags, FilteringStrictness strictness) {
    return DecisionEngine.decide(flags == null ? List.of() : flags,
        strictness == null ? defaultStrictness : strictness);
  }

  private static List<AnimalRecord> nonNull(List<AnimalRecord> animals) {
    if (animals == null) {
      return List.of();
    }
    List<AnimalRecord> out = new ArrayList<>(animals.size());
    for (AnimalRecord a : animals) {
      if (a != null) {
        out.add(a);
      } else {
        log.warn("Skipping missing animal record");
      }
    }
    return out;
  }
}
