package com.ospicorp.tumorgrowth.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MannWhitneyResult(
    @JsonProperty("U") double u,
    @JsonProperty("U1") double u1,
    @JsonProperty("U2") double u2,
    double z,
    double p,
    @JsonProperty("R1") double r1,
    @JsonProperty("R2") double r2
) {}
