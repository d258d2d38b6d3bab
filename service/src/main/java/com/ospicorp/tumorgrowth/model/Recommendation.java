package com.ospicorp.tumorgrowth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Advisory message attached to an analysis; never changes any computed result. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Recommendation(
    RecommendationLevel type,
    String category,
    String title,
    String message,
    String action,
    List<String> affectedAnimals
) {

  public static Recommendation of(RecommendationLevel type, String title, String message) {
    return new Recommendation(type, null, title, message, null, null);
  }
}
