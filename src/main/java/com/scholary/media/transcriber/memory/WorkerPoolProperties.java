package com.scholary.media.transcriber.memory;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription worker sizing.
 *
 * <p>Bound once at startup; read-only while sessions run.
 */
@ConfigurationProperties(prefix = "workers")
@Validated
public record WorkerPoolProperties(
    @Min(1) int minWorkers,
    @Min(1) int maxWorkersCap,
    @Positive double memoryPerWorkerGb,
    @PositiveOrZero double systemReserveGb,
    @Min(1) @Max(100) int memoryPressurePercent) {

  public WorkerPoolConfig toConfig() {
    return new WorkerPoolConfig(minWorkers, maxWorkersCap, memoryPerWorkerGb, systemReserveGb);
  }
}
