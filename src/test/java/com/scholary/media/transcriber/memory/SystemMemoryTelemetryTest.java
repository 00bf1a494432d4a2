package com.scholary.media.transcriber.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemMemoryTelemetryTest {

  @TempDir Path tempDir;

  @Test
  void snapshot_shouldPreferMeminfoAvailable() throws IOException {
    Path meminfo =
        Files.write(
            tempDir.resolve("meminfo"),
            List.of(
                "MemTotal:       16777216 kB",
                "MemFree:         1048576 kB",
                "MemAvailable:    4194304 kB"));

    MemorySnapshot snapshot = new SystemMemoryTelemetry(meminfo).snapshot();

    assertThat(snapshot.systemTotalGb()).isCloseTo(16.0, within(1e-9));
    assertThat(snapshot.systemAvailableGb()).isCloseTo(4.0, within(1e-9));
    assertThat(snapshot.systemUsedPercent()).isCloseTo(75.0, within(1e-9));
    assertThat(snapshot.cpuCount()).isPositive();
  }

  @Test
  void snapshot_shouldFallBackWhenMeminfoMissing() {
    MemorySnapshot snapshot = new SystemMemoryTelemetry(tempDir.resolve("absent")).snapshot();

    assertThat(snapshot.systemTotalGb()).isPositive();
    assertThat(snapshot.systemAvailableGb()).isGreaterThanOrEqualTo(0.0);
    assertThat(snapshot.systemUsedPercent()).isBetween(0.0, 100.0);
  }

  @Test
  void meminfoValue_shouldIgnoreUnknownKeys() {
    assertThat(SystemMemoryTelemetry.meminfoValue(List.of("MemTotal: 10 kB"), "MemAvailable"))
        .isEmpty();
    assertThat(SystemMemoryTelemetry.meminfoValue(List.of("MemTotal: 10 kB"), "MemTotal"))
        .hasValue(10L);
  }
}
