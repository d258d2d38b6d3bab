package com.ospicorp.tumorgrowth.outlier.model;

public enum DecisionType {
  INCLUDE, EXCLUDE
}
