package com.ospicorp.tumorgrowth.outlier.model;

import java.util.List;

public record FilteringImpact(int animalsExcluded, int measurementsExcluded, List<String> excludedAnimalIds) {}
