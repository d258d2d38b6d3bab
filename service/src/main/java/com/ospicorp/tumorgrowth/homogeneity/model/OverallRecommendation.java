package com.ospicorp.tumorgrowth.homogeneity.model;

public enum OverallRecommendation {
  PROCEED, CAUTION, REVIEW
}
