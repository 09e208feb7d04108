package com.flamingo.ai.notebook.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs source ingestion (extraction plus default transformations) after registration. */
  @Bean(name = "sourceIngestionExecutor")
  public Executor sourceIngestionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }

  /** Runs caller-initiated asynchronous transformations. */
  @Bean(name = "transformationExecutor")
  public ThreadPoolTaskExecutor transformationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("transform-");
    executor.initialize();
    return executor;
  }

  /** Runs shared source extractions, which outlive the requests that start or join them. */
  @Bean(name = "extractionExecutor")
  public ThreadPoolTaskExecutor extractionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("extract-");
    executor.initialize();
    return executor;
  }

  /** Hosts blocking calls into the extraction and assistant adapters so they can time out. */
  @Bean(name = "adapterCallExecutor")
  public ThreadPoolTaskExecutor adapterCallExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("adapter-");
    executor.initialize();
    return executor;
  }
}
