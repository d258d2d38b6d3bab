package com.ospicorp.tumorgrowth.outlier.model;

public record ExcludedPoint(double day, Double value, String reason) {}
