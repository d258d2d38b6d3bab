package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.growth.model.BatchOptions;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BatchFitRequest(@NotNull List<AnimalRecord> animals, @Valid BatchOptions options) {}
