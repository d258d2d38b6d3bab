package com.ospicorp.tumorgrowth.growth.service;

import com.ospicorp.tumorgrowth.growth.model.FitQuality;
import com.ospicorp.tumorgrowth.growth.model.GrowthModel;
import com.ospicorp.tumorgrowth.growth.model.IntervalComparison;
import com.ospicorp.tumorgrowth.growth.model.Prediction;
import com.ospicorp.tumorgrowth.growth.model.TumorWeight;
import com.ospicorp.tumorgrowth.growth.model.WeightCheck;
import com.ospicorp.tumorgrowth.growth.model.WeightPrediction;
import com.ospicorp.tumorgrowth.growth.model.WeightPredictionReport;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.stats.Statistics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Extrapolates fitted growth models and converts predicted volumes into tumor weights. */
@Service
public class PredictionService {
  private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

  /** Largest |r * day| that is still extrapolated. */
  static final double MAX_EXPONENT = 12;
  static final String TOO_EXTREME = "Prediction value too extreme - model may be unstable";

  private final GrowthMatrixService matrixService;

  public PredictionService(GrowthMatrixService matrixService) {
    this.matrixService = matrixService;
  }

  /** {@code a * e^(r * day)}, or {@code null} when the exponent is out of range. */
  public static Double extrapolate(GrowthModel model, double day) {
    double exponent = model.r() * day;
    if (!Double.isFinite(exponent) || Math.abs(exponent) > MAX_EXPONENT) {
      return null;
    }
    double value = model.a() * Math.exp(exponent);
    return Double.isFinite(value) ? value : null;
  }

  /**
   * Predicts one animal's measurement at {@code targetDay}. When both {@code lastWeight} and
   * {@code lastWeightDay} are given the prediction is also scaled to a weight.
   *
   * @throws IllegalArgumentException if the animal is missing, the target day is not finite or
   *     the series lengths differ
   */
  public Prediction predict(AnimalRecord animal, double targetDay, Double lastWeight, Double lastWeightDay) {
    if (animal == null) {
      throw new IllegalArgumentException("animal is required");
    }
    if (!Double.isFinite(targetDay)) {
      throw new IllegalArgumentException("targetDay must be a finite number");
    }
    GrowthModel model = GrowthModelFitter.fit(animal.timePoints(), animal.measurements());
    List<Double> days = availableDays(animal);
    Double minDay = days.isEmpty() ? null : days.get(0);
    Double maxDay = days.isEmpty() ? null : days.get(days.size() - 1);
    FitQuality quality = FitQuality.of(model.r2());

    if (!model.isValid()) {
      return new Prediction(animal.id(), animal.group(), targetDay, model, quality, null, null,
          days, minDay, maxDay, model.error());
    }
    Double predicted = extrapolate(model, targetDay);
    if (predicted == null) {
      log.debug("Prediction for {} at day {} out of range (r={})", animal.id(), targetDay, model.r());
      return new Prediction(animal.id(), animal.group(), targetDay, model, quality, null, null,
          days, minDay, maxDay, TOO_EXTREME);
    }

    Double predictedWeight = null;
    if (lastWeight != null && lastWeightDay != null) {
      Double lastVolume = extrapolate(model, lastWeightDay);
      if (lastVolume != null && lastVolume > 0) {
        double weight = predicted * (lastWeight / lastVolume);
        predictedWeight = Double.isFinite(weight) ? weight : null;
      }
    }
    return new Prediction(animal.id(), animal.group(), targetDay, model, quality, predicted, predictedWeight,
        days, minDay, maxDay, null);
  }

  /**
   * Predicts tumor weights at {@code targetDay} for every animal with a valid model and a recorded
   * weight. The volume-to-weight ratio is taken at the sacrifice day, from the measured volume.
   *
   * @throws IllegalArgumentException if {@code targetDay} is not positive
   */
  public WeightPredictionReport predictWeights(List<AnimalRecord> animals, List<TumorWeight> weights,
      double targetDay, boolean compareGroups) {
    if (!Double.isFinite(targetDay) || targetDay <= 0) {
      throw new IllegalArgumentException("targetDay must be positive");
    }
    List<TumorWeight> recorded = new ArrayList<>();
    Map<String, TumorWeight> weightByAnimal = new LinkedHashMap<>();
    if (weights != null) {
      for (TumorWeight w : weights) {
        if (w != null && w.animalId() != null) {
          recorded.add(w);
          weightByAnimal.putIfAbsent(w.animalId(), w);
        }
      }
    }

    Map<String, AnimalRecord> byId = new LinkedHashMap<>();
    Map<String, GrowthModel> models = new LinkedHashMap<>();
    if (animals != null) {
      for (AnimalRecord animal : animals) {
        if (animal == null || animal.id() == null || byId.containsKey(animal.id())) continue;
        byId.put(animal.id(), animal);
        try {
          GrowthModel model = GrowthModelFitter.fit(animal.timePoints(), animal.measurements());
          if (model.isValid()) {
            models.put(animal.id(), model);
          }
        } catch (IllegalArgumentException ex) {
          log.warn("Skipping weight prediction for animal {}: {}", animal.id(), ex.getMessage());
        }
      }
    }

    List<WeightPrediction> predictions = new ArrayList<>();
    models.forEach((id, model) -> {
      WeightPrediction p = predictWeight(byId.get(id), model, weightByAnimal.get(id), targetDay);
      if (p != null) predictions.add(p);
    });

    List<WeightCheck> checks = new ArrayList<>(recorded.size());
    for (TumorWeight w : recorded) {
      checks.add(check(w, byId.get(w.animalId()), models.get(w.animalId()), predictions, targetDay));
    }

    List<IntervalComparison> comparisons = compareGroups ? compareGroups(predictions) : List.of();
    log.info("Weight predictions at day {}: {} of {} animal(s), {} group comparison(s)",
        targetDay, predictions.size(), byId.size(), comparisons.size());
    return new WeightPredictionReport(targetDay, predictions, checks, comparisons);
  }

  private WeightPrediction predictWeight(AnimalRecord animal, GrowthModel model, TumorWeight weight,
      double targetDay) {
    if (weight == null) return null;
    Double predictedVolume = extrapolate(model, targetDay);
    if (predictedVolume == null) return null;
    Double sacrificeDay = weight.day() != null ? weight.day() : lastDay(animal);
    if (sacrificeDay == null || extrapolate(model, sacrificeDay) == null) return null;

    int idx = animal.indexOfDay(sacrificeDay);
    Double experimentalVolume = idx >= 0 ? animal.measurements().get(idx) : null;
    if (!AnimalRecord.isPositive(experimentalVolume)) return null;

    double predictedWeight = predictedVolume * (weight.weight() / experimentalVolume);
    if (!Double.isFinite(predictedWeight)) return null;
    return new WeightPrediction(animal.id(), animal.groupKey(), predictedVolume, predictedWeight,
        weight.weight(), targetDay, model.r2());
  }

  private static WeightCheck check(TumorWeight weight, AnimalRecord animal, GrowthModel model,
      List<WeightPrediction> predictions, double targetDay) {
    String group = weight.group() != null ? weight.group() : animal != null ? animal.group() : null;
    boolean predicted = predictions.stream().anyMatch(p -> p.animalId().equals(weight.animalId()));
    if (!predicted || model == null) {
      return new WeightCheck(weight.animalId(), group, weight.weight(), null, null, null, null);
    }
    List<Double> days = availableDays(animal);
    double minDay = days.get(0);
    double maxDay = days.get(days.size() - 1);

    Double actual = null;
    Double modelValue = null;
    Double error = null;
    if (targetDay >= minDay && targetDay <= maxDay) {
      int idx = animal.indexOfDay(targetDay);
      if (idx >= 0) {
        actual = animal.measurements().get(idx);
        modelValue = extrapolate(model, targetDay);
        if (modelValue != null && AnimalRecord.isPositive(actual)) {
          error = Math.abs(modelValue - actual) / actual * 100;
        }
      }
    }
    return new WeightCheck(weight.animalId(), group, weight.weight(), error, maxDay, actual, modelValue);
  }

  private List<IntervalComparison> compareGroups(List<WeightPrediction> predictions) {
    Map<String, List<WeightPrediction>> groups = Statistics.groupBy(predictions, WeightPrediction::group);
    if (groups.size() < 2) {
      return List.of();
    }
    List<String> names = new ArrayList<>(groups.keySet());
    List<IntervalComparison> out = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      for (int j = i + 1; j < names.size(); j++) {
        out.add(matrixService.compare(names.get(i), weightsOf(groups.get(names.get(i))),
            names.get(j), weightsOf(groups.get(names.get(j)))));
      }
    }
    return out;
  }

  private static List<Double> weightsOf(List<WeightPrediction> predictions) {
    return predictions.stream().map(WeightPrediction::predictedWeight).toList();
  }

  /** Sorted distinct finite days that carry a measurement slot. */
  static List<Double> availableDays(AnimalRecord animal) {
    TreeSet<Double> days = new TreeSet<>();
    for (int i = 0; i < animal.pairCount(); i++) {
      Double day = animal.timePoints().get(i);
      if (AnimalRecord.isFinite(day)) {
        days.add(day);
      }
    }
    return new ArrayList<>(days);
  }

  private static Double lastDay(AnimalRecord animal) {
    List<Double> days = availableDays(animal);
    return days.isEmpty() ? null : days.get(days.size() - 1);
  }
}
