package com.scholary.media.transcriber.memory;

/**
 * Inputs to the worker count formula that do not change during a run.
 *
 * @param minWorkers lower bound on the worker count, at least 1
 * @param maxWorkersCap upper bound on the worker count, at least {@code minWorkers}
 * @param memoryPerWorkerGb memory one worker and its model need
 * @param systemReserveGb memory kept free for the OS and the main process
 */
public record WorkerPoolConfig(
    int minWorkers, int maxWorkersCap, double memoryPerWorkerGb, double systemReserveGb) {

  public WorkerPoolConfig {
    if (minWorkers < 1) {
      throw new IllegalArgumentException("minWorkers must be >= 1");
    }
    if (maxWorkersCap < minWorkers) {
      throw new IllegalArgumentException("maxWorkersCap must be >= minWorkers");
    }
    if (!(memoryPerWorkerGb > 0)) {
      throw new IllegalArgumentException("memoryPerWorkerGb must be positive");
    }
    if (systemReserveGb < 0) {
      throw new IllegalArgumentException("systemReserveGb must not be negative");
    }
  }
}
