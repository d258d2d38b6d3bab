package com.ospicorp.tumorgrowth.outlier.model;

import java.util.List;

public record DatasetView(List<AnnotatedAnimal> animals, int count, int totalMeasurements) {

  public static DatasetView of(List<AnnotatedAnimal> animals) {
    int total = animals.stream().mapToInt(a -> a.measurements().size()).sum();
    return new DatasetView(List.copyOf(animals), animals.size(), total);
  }
}
