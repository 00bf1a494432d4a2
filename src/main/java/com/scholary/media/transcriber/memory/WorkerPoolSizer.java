package com.scholary.media.transcriber.memory;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides how many transcription workers a session may run.
 *
 * <p>Each worker holds its own speech model, so the worker count is bounded by free memory as well
 * as by CPU count and the configured cap. Telemetry is read on every call; the answer reflects
 * memory at the moment the transcription stage starts.
 */
@Component
public class WorkerPoolSizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPoolSizer.class);

  private static final double CRITICAL_PERCENT = 90.0;
  private static final double WARNING_PERCENT = 80.0;
  private static final double LOW_MEMORY_GB = 2.0;

  private final MemoryTelemetry telemetry;
  private final WorkerPoolConfig config;
  private final int memoryPressurePercent;

  public WorkerPoolSizer(MemoryTelemetry telemetry, WorkerPoolProperties properties) {
    this.telemetry = telemetry;
    this.config = properties.toConfig();
    this.memoryPressurePercent = properties.memoryPressurePercent();
  }

  /**
   * Worker count for the given resources.
   *
   * <p>Never below {@code minWorkers}; above {@code min(cpuCount, maxWorkersCap)} only when
   * {@code minWorkers} itself is.
   */
  public static int computeWorkers(double availableGb, int cpuCount, WorkerPoolConfig config) {
    int memoryBudget =
        (int) Math.floor((availableGb - config.systemReserveGb()) / config.memoryPerWorkerGb());
    memoryBudget = Math.max(config.minWorkers(), memoryBudget);

    int optimal = Math.min(cpuCount, Math.min(config.maxWorkersCap(), memoryBudget));
    return Math.max(config.minWorkers(), optimal);
  }

  /** Worker count for the current memory state. */
  public int optimalWorkers() {
    MemorySnapshot snapshot = telemetry.snapshot();
    int workers = computeWorkers(snapshot.systemAvailableGb(), snapshot.cpuCount(), config);
    LOGGER.info(
        "Worker pool sized: workers={}, availableGb={}, cpus={}, usedPercent={}",
        workers,
        String.format("%.1f", snapshot.systemAvailableGb()),
        snapshot.cpuCount(),
        String.format("%.1f", snapshot.systemUsedPercent()));
    return workers;
  }

  /** Advisory only; nothing blocks on it. */
  public boolean isUnderMemoryPressure() {
    return telemetry.snapshot().systemUsedPercent() > memoryPressurePercent;
  }

  /**
   * Advisory messages about the current memory state, keyed by category.
   *
   * <p>Categories: {@code critical}, {@code warning}, {@code low_memory}, {@code worker_limit}.
   * Empty when nothing needs attention.
   */
  public Map<String, String> recommendations() {
    MemorySnapshot snapshot = telemetry.snapshot();
    Map<String, String> advice = new LinkedHashMap<>();

    if (snapshot.systemUsedPercent() > CRITICAL_PERCENT) {
      advice.put(
          "critical",
          String.format(
              "Memory usage critical (%.1f%%). Reduce concurrent sessions.",
              snapshot.systemUsedPercent()));
    } else if (snapshot.systemUsedPercent() > WARNING_PERCENT) {
      advice.put(
          "warning",
          String.format(
              "Memory usage high (%.1f%%). Monitor closely.", snapshot.systemUsedPercent()));
    }

    if (snapshot.systemAvailableGb() < LOW_MEMORY_GB) {
      advice.put(
          "low_memory",
          String.format(
              "Only %.1f GB available. Processing will use the minimum worker count.",
              snapshot.systemAvailableGb()));
    }

    int workers = computeWorkers(snapshot.systemAvailableGb(), snapshot.cpuCount(), config);
    if (workers < Math.min(snapshot.cpuCount(), config.maxWorkersCap())) {
      advice.put(
          "worker_limit",
          String.format(
              "Memory limits workers to %d of %d CPUs.", workers, snapshot.cpuCount()));
    }

    return advice;
  }
}
