package com.ospicorp.tumorgrowth.config;

import com.ospicorp.tumorgrowth.batch.ChunkedExecutor;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pool shared by batch fitting and large anomaly scans. */
@Configuration
public class AnalysisExecutorConfig {
  private static final Logger log = LoggerFactory.getLogger(AnalysisExecutorConfig.class);

  @Bean
  ThreadPoolTaskExecutor analysisExecutor(
      @Value("${tumorgrowth.batch.workers:4}") int workers,
      @Value("${tumorgrowth.batch.queue-capacity:1000}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("analysis-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    log.info("Analysis executor initialized: workers={}, queue={}", workers, queueCapacity);
    return executor;
  }

  @Bean
  ChunkedExecutor chunkedExecutor(ThreadPoolTaskExecutor analysisExecutor,
      @Value("${tumorgrowth.batch.timeout-ms:30000}") long timeoutMs,
      @Value("${tumorgrowth.batch.workers:4}") int workers) {
    return new ChunkedExecutor(analysisExecutor, Duration.ofMillis(timeoutMs), workers);
  }
}
