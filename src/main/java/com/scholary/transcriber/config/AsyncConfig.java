package com.scholary.transcriber.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: one runs whole transcription tasks, the other runs the segments of
 * those tasks when more than one segment worker is configured. Task threads block on their
 * segments, so segments must never be queued on the task pool.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("transcription-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "segmentExecutor")
  public Executor segmentExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.segmentWorkers());
    executor.setMaxPoolSize(properties.segmentWorkers());
    executor.setThreadNamePrefix("segment-");
    executor.initialize();
    return executor;
  }
}
