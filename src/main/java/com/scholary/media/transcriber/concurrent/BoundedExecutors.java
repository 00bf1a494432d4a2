package com.scholary.media.transcriber.concurrent;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Factory for the short-lived, fixed-size pools each pipeline stage runs on.
 *
 * <p>Pool sizes are decided per session (chunk count, live memory), so these executors are built
 * on demand rather than registered as beans. Callers own the returned executor and must call
 * {@link ThreadPoolTaskExecutor#shutdown()} when the stage is done.
 */
public final class BoundedExecutors {

  private BoundedExecutors() {}

  /**
   * Create and initialize a fixed-size executor.
   *
   * @param threadNamePrefix prefix for pool thread names
   * @param threads number of threads (core = max)
   * @return an initialized executor with an unbounded queue and MDC propagation
   */
  public static ThreadPoolTaskExecutor fixed(String threadNamePrefix, int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("Thread count must be positive: " + threads);
    }
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
