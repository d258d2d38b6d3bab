package com.ospicorp.tumorgrowth.stats;

public record IqrBounds(double q1, double q3, double iqr, double lower, double upper) {

  static final IqrBounds EMPTY = new IqrBounds(0d, 0d, 0d, 0d, 0d);

  public boolean excludes(double value) {
    return value < lower || value > upper;
  }
}
