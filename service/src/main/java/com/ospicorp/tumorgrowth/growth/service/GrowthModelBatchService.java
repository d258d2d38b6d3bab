package com.ospicorp.tumorgrowth.growth.service;

import com.ospicorp.tumorgrowth.batch.ChunkedExecutor;
import com.ospicorp.tumorgrowth.growth.model.AnimalMetrics;
import com.ospicorp.tumorgrowth.growth.model.BatchOptions;
import com.ospicorp.tumorgrowth.growth.model.BatchProgress;
import com.ospicorp.tumorgrowth.growth.model.BatchResult;
import com.ospicorp.tumorgrowth.growth.model.BatchStats;
import com.ospicorp.tumorgrowth.growth.model.FittedAnimal;
import com.ospicorp.tumorgrowth.growth.model.GrowthModel;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class GrowthModelBatchService {
  private static final Logger log = LoggerFactory.getLogger(GrowthModelBatchService.class);
  static final int PROGRESS_INTERVAL = 10;

  private final ChunkedExecutor chunkedExecutor;
  private final int defaultBatchSize;
  private final double defaultR2Threshold;

  public GrowthModelBatchService(ChunkedExecutor chunkedExecutor,
      @Value("${tumorgrowth.batch.default-batch-size:50}") int defaultBatchSize,
      @Value("${tumorgrowth.growth.r2-threshold:0.8}") double defaultR2Threshold) {
    this.chunkedExecutor = chunkedExecutor;
    this.defaultBatchSize = defaultBatchSize;
    this.defaultR2Threshold = defaultR2Threshold;
  }

  public GrowthModel fit(List<Double> timePoints, List<Double> measurements) {
    return GrowthModelFitter.fit(timePoints, measurements);
  }

  public BatchResult fitBatch(List<AnimalRecord> animals, BatchOptions options) {
    return fitBatch(animals, options, progress -> log.debug("Batch {}/{} at {}% (overall {}%)",
        progress.batchIndex() + 1, progress.totalBatches(), progress.batchProgress(),
        progress.overallProgress()));
  }

  public BatchResult fitBatch(List<AnimalRecord> animals, BatchOptions options,
      Consumer<BatchProgress> progress) {
    long start = System.nanoTime();
    List<AnimalRecord> input = animals == null ? List.of() : animals;
    BatchOptions opts = options == null ? BatchOptions.defaults() : options;
    int batchSize = opts.batchSize() != null ? opts.batchSize() : defaultBatchSize;
    double threshold = opts.r2Threshold() != null ? opts.r2Threshold() : defaultR2Threshold;
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be positive");
    }

    AtomicInteger processed = new AtomicInteger();
    int total = input.size();
    List<FittedAnimal> fitted = chunkedExecutor.map(input, batchSize, (batchIndex, totalBatches, batch) -> {
      List<FittedAnimal> out = new ArrayList<>(batch.size());
      for (int i = 0; i < batch.size(); i++) {
        out.add(fitOne(batch.get(i), threshold));
        int overall = processed.incrementAndGet();
        if ((i + 1) % PROGRESS_INTERVAL == 0 || i == batch.size() - 1) {
          progress.accept(new BatchProgress(batchIndex, totalBatches,
              percent(i + 1, batch.size()), percent(overall, total)));
        }
      }
      return out;
    });

    int validModels = 0;
    int accepted = 0;
    for (FittedAnimal animal : fitted) {
      if (animal.model().isValid()) validModels++;
      if (animal.accepted()) accepted++;
    }
    double elapsedMs = (System.nanoTime() - start) / 1_000_000d;
    int batches = total == 0 ? 0 : (total + batchSize - 1) / batchSize;
    log.info("Fitted {} animal(s) in {} batch(es): {} valid, {} accepted (r2 >= {})",
        total, batches, validModels, accepted, threshold);
    return new BatchResult(fitted, new BatchStats(total, validModels, accepted, elapsedMs, batches));
  }

  private FittedAnimal fitOne(AnimalRecord animal, double threshold) {
    if (animal == null) {
      return new FittedAnimal(null, null, List.of(), List.of(),
          GrowthModel.failed(0, "Animal record is missing"), null, false);
    }
    try {
      GrowthModel model = GrowthModelFitter.fit(animal.timePoints(), animal.measurements());
      AnimalMetrics metrics = AnimalMetrics.of(animal.measurements());
      boolean accepted = model.isValid() && model.validPoints() >= GrowthModelFitter.MIN_POINTS
          && model.r2() >= threshold;
      return new FittedAnimal(animal.id(), animal.group(), animal.timePoints(), animal.measurements(),
          model, metrics, accepted);
    } catch (RuntimeException ex) {
      log.warn("Growth model fit failed for animal {}: {}", animal.id(), ex.getMessage());
      return new FittedAnimal(animal.id(), animal.group(), animal.timePoints(), animal.measurements(),
          GrowthModel.failed(0, ex.getMessage()), null, false);
    }
  }

  private static int percent(int done, int of) {
    return of == 0 ? 100 : (int) Math.round(done * 100d / of);
  }
}
