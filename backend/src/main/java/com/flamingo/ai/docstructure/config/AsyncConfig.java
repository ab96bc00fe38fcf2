package com.flamingo.ai.docstructure.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for cross-document processing and per-item embedding lookups. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentExecutor")
  public Executor documentExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-structure-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }
}
