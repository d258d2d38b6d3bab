package com.ospicorp.tumorgrowth.web;

import com.ospicorp.tumorgrowth.growth.model.BatchResult;
import com.ospicorp.tumorgrowth.growth.model.GrowthMatrix;
import com.ospicorp.tumorgrowth.growth.model.GrowthModel;
import com.ospicorp.tumorgrowth.growth.model.IntervalComparison;
import com.ospicorp.tumorgrowth.growth.model.Prediction;
import com.ospicorp.tumorgrowth.growth.model.WeightPredictionReport;
import com.ospicorp.tumorgrowth.growth.service.GrowthMatrixService;
import com.ospicorp.tumorgrowth.growth.service.GrowthModelBatchService;
import com.ospicorp.tumorgrowth.growth.service.PredictionService;
import com.ospicorp.tumorgrowth.web.dto.AnimalsRequest;
import com.ospicorp.tumorgrowth.web.dto.BatchFitRequest;
import com.ospicorp.tumorgrowth.web.dto.CompareRequest;
import com.ospicorp.tumorgrowth.web.dto.FitRequest;
import com.ospicorp.tumorgrowth.web.dto.PredictRequest;
import com.ospicorp.tumorgrowth.web.dto.WeightPredictionRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Tag(name = "Growth")
public class GrowthController {

  private final GrowthModelBatchService modelService;
  private final GrowthMatrixService matrixService;
  private final PredictionService predictionService;

  public GrowthController(GrowthModelBatchService modelService, GrowthMatrixService matrixService,
      PredictionService predictionService) {
    this.modelService = modelService;
    this.matrixService = matrixService;
    this.predictionService = predictionService;
  }

  @PostMapping("/growth-models")
  @Operation(summary = "Fit one exponential growth model", description = "Least squares fit of ln(y) = ln(a) + r*t.")
  public GrowthModel fit(@Valid @RequestBody FitRequest request) {
    return modelService.fit(request.timePoints(), request.measurements());
  }

  @PostMapping("/growth-models/batch")
  @Operation(summary = "Fit growth models for many animals",
      description = "Animals are fitted in parallel chunks; a failing animal carries its own error.")
  public BatchResult fitBatch(@Valid @RequestBody BatchFitRequest request) {
    return modelService.fitBatch(request.animals(), request.options());
  }

  @PostMapping("/growth-models/predictions")
  @Operation(summary = "Extrapolate one animal's growth model",
      description = "Predicted measurement at targetDay, scaled to a weight when lastWeight and lastWeightDay are given.")
  public Prediction predict(@Valid @RequestBody PredictRequest request) {
    return predictionService.predict(request.animal(), request.targetDay(), request.lastWeight(),
        request.lastWeightDay());
  }

  @PostMapping("/growth-models/weight-predictions")
  @Operation(summary = "Predict tumor weights at a target day",
      description = "Uses each animal's recorded weight and measured volume at sacrifice; groups are compared pairwise.")
  public WeightPredictionReport predictWeights(@Valid @RequestBody WeightPredictionRequest request) {
    return predictionService.predictWeights(request.animals(), request.weights(), request.targetDay(),
        !Boolean.FALSE.equals(request.compareGroups()));
  }

  @PostMapping("/growth-matrices")
  @Operation(summary = "Growth-rate matrices per group")
  public Map<String, GrowthMatrix> matrices(@Valid @RequestBody AnimalsRequest request) {
    return matrixService.matrices(request.animals());
  }

  @PostMapping("/growth-matrices/compare")
  @Operation(summary = "Compare two growth-rate intervals",
      description = "Mann-Whitney U test and Cohen's d on the individual rates of two intervals.")
  public IntervalComparison compare(@Valid @RequestBody CompareRequest request) {
    return matrixService.compare(request.animals(), request.first(), request.second());
  }
}
