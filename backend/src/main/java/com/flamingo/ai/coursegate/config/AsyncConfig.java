package com.flamingo.ai.coursegate.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the section worker pool. */
@Configuration
public class AsyncConfig {

  @Bean(name = "sectionExecutor")
  public Executor sectionExecutor(PipelineConfig pipelineConfig) {
    PipelineConfig.Workers workers = pipelineConfig.getWorkers();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers.getPoolSize());
    executor.setMaxPoolSize(workers.getPoolSize());
    executor.setQueueCapacity(workers.getQueueCapacity());
    executor.setThreadNamePrefix("section-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
