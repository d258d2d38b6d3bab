package com.ospicorp.tumorgrowth.outlier.model;

import com.ospicorp.tumorgrowth.model.Recommendation;
import java.util.List;

public record AnalysisResult(
    List<AnnotatedAnimal> animals,
    List<Flag> flags,
    List<Decision> decisions,
    DualAnalysis dualAnalysis,
    PointFilteringAnalysis pointFilteringAnalysis,
    AnalysisSummary summary,
    List<Recommendation> recommendations,
    List<Recommendation> specificRecommendations,
    FilteringStrictness filteringStrictness,
    DataType dataType,
    List<String> log
) {}
