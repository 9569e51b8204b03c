package com.scholary.captions.config;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for caption jobs.
 *
 * <p>{@code taskExecutor} runs whole jobs. {@code captionWorkerExecutor} runs the per-chunk and
 * per-gap collaborator calls of all jobs. Both copy the submitting thread's MDC so worker logs
 * carry the job context.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(CaptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("caption-job-");
    executor.setTaskDecorator(mdcPropagation());
    executor.initialize();
    return executor;
  }

  @Bean(name = "captionWorkerExecutor")
  public Executor captionWorkerExecutor(CaptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setThreadNamePrefix("caption-worker-");
    // Full queue: the job thread does the call itself.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setTaskDecorator(mdcPropagation());
    executor.initialize();
    return executor;
  }

  static TaskDecorator mdcPropagation() {
    return runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        try {
          if (context != null) {
            MDC.setContextMap(context);
          }
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
