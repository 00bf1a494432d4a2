package com.scholary.media.transcriber.config;

import com.scholary.media.transcriber.concurrent.MdcTaskDecorator;
import com.scholary.media.transcriber.progress.ProgressProperties;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for asynchronous progress emission.
 *
 * <p>A single thread delivers snapshots to the progress observer so emissions for a session keep
 * their order. The queue is bounded; when it is full the oldest pending emission is dropped, so a
 * stalled observer can never block the pipeline.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "progressEmitter")
  public Executor progressEmitter(ProgressProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(properties.emitterQueueSize());
    executor.setThreadNamePrefix("progress-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
    executor.initialize();
    return executor;
  }
}
