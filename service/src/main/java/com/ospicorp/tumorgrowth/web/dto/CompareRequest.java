package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.growth.model.IntervalRef;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record CompareRequest(
    @NotNull List<AnimalRecord> animals,
    @NotNull @Valid IntervalRef first,
    @NotNull @Valid IntervalRef second
) {}
