package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.model.AnimalRecord;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record AnimalsRequest(@NotNull List<AnimalRecord> animals) {}
