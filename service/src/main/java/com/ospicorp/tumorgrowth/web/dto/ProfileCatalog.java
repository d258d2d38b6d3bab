package com.ospicorp.tumorgrowth.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import com.ospicorp.tumorgrowth.outlier.model.FlagInfo;
import com.ospicorp.tumorgrowth.outlier.model.SensitivityProfile;
import java.util.List;
import java.util.Map;

public record ProfileCatalog(
    String defaultProfile,
    FilteringStrictness defaultFilteringStrictness,
    List<Entry> profiles,
    Map<String, FlagInfo> flagTypes
) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Entry(String code, String description, SensitivityProfile thresholds) {}
}
