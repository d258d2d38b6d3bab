package com.ospicorp.tumorgrowth.stats;

public record BasicStats(double mean, double std, double min, double max, double median, int count) {

  static final BasicStats EMPTY = new BasicStats(0d, 0d, 0d, 0d, 0d, 0);
}
