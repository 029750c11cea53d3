package dev.librarian.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Background executor for batch classification.
 *
 * <p>A single worker: a batch runs sequentially and at most one batch runs at a time. Callers
 * guard against overlapping runs; the one-slot queue only absorbs a new run submitted while the
 * previous worker is still winding down.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "classificationExecutor")
  public ThreadPoolTaskExecutor classificationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(1);
    executor.setThreadNamePrefix("classify-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
