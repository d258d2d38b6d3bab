package com.ospicorp.tumorgrowth.outlier.model;

import com.ospicorp.tumorgrowth.model.AnimalRecord;
import java.util.List;

/** Input animal plus the flags raised by the per-animal scan. */
public record AnnotatedAnimal(
    String id,
    String group,
    List<Double> timePoints,
    List<Double> measurements,
    List<Flag> flags,
    List<FlaggedMeasurement> flaggedMeasurements
) {

  public static AnnotatedAnimal of(AnimalRecord animal, List<Flag> flags, List<FlaggedMeasurement> flagged) {
    return new AnnotatedAnimal(animal.id(), animal.group(), animal.timePoints(), animal.measurements(),
        List.copyOf(flags), List.copyOf(flagged));
  }
}
