package com.ospicorp.tumorgrowth.growth.model;

/** Advisory progress event; percentages are rounded to whole numbers. */
public record BatchProgress(int batchIndex, int totalBatches, int batchProgress, int overallProgress) {}
