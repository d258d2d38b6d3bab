package com.ospicorp.tumorgrowth.web.dto;

import com.ospicorp.tumorgrowth.outlier.model.Decision;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import java.util.List;

public record DecisionsResponse(FilteringStrictness filteringStrictness, int excluded, int included,
    List<Decision> decisions) {

  public static DecisionsResponse of(FilteringStrictness strictness, List<Decision> decisions) {
    int excluded = (int) decisions.stream().filter(Decision::isExclude).count();
    return new DecisionsResponse(strictness, excluded, decisions.size() - excluded, decisions);
  }
}
