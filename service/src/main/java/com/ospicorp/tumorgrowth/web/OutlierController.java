package com.ospicorp.tumorgrowth.web;

import com.ospicorp.tumorgrowth.config.CsvHttpMessageConverter;
import com.ospicorp.tumorgrowth.outlier.model.AnalysisResult;
import com.ospicorp.tumorgrowth.outlier.model.DataType;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import com.ospicorp.tumorgrowth.outlier.model.FlagInfo;
import com.ospicorp.tumorgrowth.outlier.model.FlagType;
import com.ospicorp.tumorgrowth.outlier.model.ProfilePreset;
import com.ospicorp.tumorgrowth.outlier.model.SensitivityProfile;
import com.ospicorp.tumorgrowth.outlier.service.OutlierAnalysisService;
import com.ospicorp.tumorgrowth.web.dto.AnalysisRequest;
import com.ospicorp.tumorgrowth.web.dto.DecisionsResponse;
import com.ospicorp.tumorgrowth.web.dto.FlagRow;
import com.ospicorp.tumorgrowth.web.dto.ProfileCatalog;
import com.ospicorp.tumorgrowth.web.dto.RedecideRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Tag(name = "Outliers")
public class OutlierController {

  private final OutlierAnalysisService service;

  public OutlierController(OutlierAnalysisService service) {
    this.service = service;
  }

  @GetMapping("/profiles")
  @Operation(summary = "List sensitivity profiles", description = "Named presets, defaults and flag type metadata.")
  public ProfileCatalog profiles() {
    List<ProfileCatalog.Entry> entries = new ArrayList<>();
    for (ProfilePreset preset : ProfilePreset.values()) {
      SensitivityProfile thresholds = preset.profile().orElse(null);
      String description = thresholds != null ? thresholds.name()
          : "Chosen from the largest group size: up to 8 ultraConservative, up to 12 conservative, else moderate";
      entries.add(new ProfileCatalog.Entry(preset.code(), description, thresholds));
    }
    Map<String, FlagInfo> flagTypes = new LinkedHashMap<>();
    for (FlagType type : FlagType.values()) {
      flagTypes.put(type.name(), type.info());
    }
    return new ProfileCatalog(service.defaultPreset().code(), service.defaultStrictness(), entries, flagTypes);
  }

  @PostMapping("/outliers")
  @Operation(summary = "Analyze a dataset",
      description = "Flags anomalies, derives include/exclude decisions and builds the filtered views.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Analysis result",
          content = {
              @Content(mediaType = "application/json", schema = @Schema(implementation = AnalysisResult.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "Analysis timed out",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> analyze(@Valid @RequestBody AnalysisRequest request,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "json or csv; csv returns the flag list only") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = RequestCodes.mediaType(format, accept);
    ProfilePreset preset = RequestCodes.profile(request.profile());
    FilteringStrictness strictness = RequestCodes.strictness(request.filteringStrictness());
    DataType dataType = RequestCodes.dataType(request.dataType());

    SensitivityProfile profile = service.resolveProfile(preset == null ? null : preset.code(),
        request.customProfile(), request.animals());
    AnalysisResult result = service.analyzeDataset(request.animals(), profile, strictness, dataType);

    if (contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
      List<FlagRow> rows = result.flags().stream().map(FlagRow::of).toList();
      return ResponseEntity.ok().contentType(contentType).body(rows);
    }
    return ResponseEntity.ok().contentType(contentType).body(result);
  }

  @PostMapping("/outliers/decisions")
  @Operation(summary = "Re-derive decisions",
      description = "Applies another filtering strictness to an existing flag list without rescanning animals.")
  public DecisionsResponse redecide(@Valid @RequestBody RedecideRequest request) {
    FilteringStrictness strictness = RequestCodes.strictness(request.filteringStrictness());
    FilteringStrictness effective = strictness == null ? service.defaultStrictness() : strictness;
    return DecisionsResponse.of(effective, service.redecide(request.flags(), effective));
  }
}
