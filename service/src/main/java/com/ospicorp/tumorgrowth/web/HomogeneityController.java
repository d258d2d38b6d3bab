package com.ospicorp.tumorgrowth.web;

import com.ospicorp.tumorgrowth.homogeneity.model.HomogeneityReport;
import com.ospicorp.tumorgrowth.homogeneity.model.HomogeneityThresholds;
import com.ospicorp.tumorgrowth.homogeneity.service.HomogeneityEvaluator;
import com.ospicorp.tumorgrowth.web.dto.AnimalsRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/homogeneity")
@Tag(name = "Homogeneity")
public class HomogeneityController {

  private final HomogeneityEvaluator evaluator;

  public HomogeneityController(HomogeneityEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  @PostMapping
  @Operation(summary = "Evaluate baseline homogeneity", description = "Baseline CV, score and quality per group.")
  public HomogeneityReport evaluate(@Valid @RequestBody AnimalsRequest request) {
    return evaluator.evaluate(request.animals());
  }

  @GetMapping("/config")
  @Operation(summary = "Active CV thresholds and sample-size factors")
  public HomogeneityThresholds config() {
    return evaluator.thresholds();
  }
}
