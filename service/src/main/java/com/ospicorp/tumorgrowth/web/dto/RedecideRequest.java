package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.outlier.model.Flag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record RedecideRequest(@NotNull List<@NotNull @Valid Flag> flags, String filteringStrictness) {}
