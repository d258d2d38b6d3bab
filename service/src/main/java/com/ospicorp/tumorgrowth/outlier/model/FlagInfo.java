package com.ospicorp.tumorgrowth.outlier.model;

public record FlagInfo(Severity severity, String name, String color) {}
