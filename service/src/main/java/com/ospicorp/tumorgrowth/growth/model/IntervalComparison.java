package com.ospicorp.tumorgrowth.growth.model;

import com.ospicorp.tumorgrowth.stats.EffectSize;
import com.ospicorp.tumorgrowth.stats.MannWhitneyResult;

public record IntervalComparison(
    String label1,
    String label2,
    int n1,
    int n2,
    MannWhitneyResult mannWhitney,
    EffectSize cohensD,
    double median1,
    double median2,
    boolean significant,
    String asterisks
) {}
