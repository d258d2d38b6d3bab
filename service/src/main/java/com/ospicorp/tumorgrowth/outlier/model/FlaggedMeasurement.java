package com.ospicorp.tumorgrowth.outlier.model;

import java.util.List;

public record FlaggedMeasurement(int index, double day, Double value, List<Flag> flags) {}
