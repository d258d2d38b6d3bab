package com.ospicorp.tumorgrowth.web.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;

public record FitRequest(@NotNull List<Double> timePoints, @NotNull List<Double> measurements) {}
