package com.ospicorp.tumorgrowth.growth.model;

public record BatchStats(
    int totalAnimals,
    int validModels,
    int acceptedModels,
    double processingTime,
    int batchesProcessed
) {}
