package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.outlier.model.SensitivityProfile;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record AnalysisRequest(
    @NotNull List<AnimalRecord> animals,
    @Schema(description = "Named profile: ultraConservative, conservative, moderate or auto", example = "auto")
    String profile,
    @Schema(description = "Custom thresholds; takes precedence over the named profile")
    @Valid SensitivityProfile customProfile,
    @Schema(description = "critical, criticalAndHigh or all", example = "criticalAndHigh")
    String filteringStrictness,
    @Schema(description = "volume or bli", example = "volume")
    String dataType
) {}
