package com.ospicorp.tumorgrowth.outlier.model;

public record DualAnalysis(DatasetView complete, DatasetView filtered, FilteringImpact impact) {}
