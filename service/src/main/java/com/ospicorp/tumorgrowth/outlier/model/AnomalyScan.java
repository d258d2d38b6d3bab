package com.ospicorp.tumorgrowth.outlier.model;

import java.util.List;

/** Detection output: annotated animals, all flags (per-animal first, then group) and a run log. */
public record AnomalyScan(List<AnnotatedAnimal> animals, List<Flag> flags, List<String> log) {}
