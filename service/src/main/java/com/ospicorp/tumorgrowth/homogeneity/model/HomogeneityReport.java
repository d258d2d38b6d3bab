package com.ospicorp.tumorgrowth.homogeneity.model;

import com.ospicorp.tumorgrowth.model.Recommendation;
import java.util.List;
import java.util.Map;

public record HomogeneityReport(
    int totalAnimals,
    int totalGroups,
    Map<String, GroupHomogeneity> groupAnalysis,
    OverallAssessment overallAssessment,
    List<Recommendation> recommendations
) {}
