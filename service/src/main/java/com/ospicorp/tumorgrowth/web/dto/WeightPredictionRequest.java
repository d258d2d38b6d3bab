package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.growth.model.TumorWeight;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

/** {@code compareGroups} defaults to true. */
public record WeightPredictionRequest(
    @NotNull List<AnimalRecord> animals,
    @NotNull List<@NotNull @Valid TumorWeight> weights,
    @NotNull @Positive Double targetDay,
    Boolean compareGroups
) {}
