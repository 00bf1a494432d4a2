package com.scholary.media.transcriber.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkerPoolSizerTest {

  private static final WorkerPoolConfig CONFIG = new WorkerPoolConfig(1, 8, 1.5, 2.0);

  @Mock private MemoryTelemetry telemetry;

  private WorkerPoolSizer sizer;

  @BeforeEach
  void setUp() {
    sizer = new WorkerPoolSizer(telemetry, new WorkerPoolProperties(1, 8, 1.5, 2.0, 85));
  }

  @ParameterizedTest
  @CsvSource({
    // availableGb, cpus, expected
    "32.0, 4, 4",
    "32.0, 16, 8",
    "6.5, 16, 3",
    "2.0, 16, 1",
    "0.0, 16, 1",
    "-3.0, 2, 1"
  })
  void computeWorkers_shouldTakeTightestBound(double availableGb, int cpus, int expected) {
    assertThat(WorkerPoolSizer.computeWorkers(availableGb, cpus, CONFIG)).isEqualTo(expected);
  }

  @Test
  void computeWorkers_shouldStayWithinBoundsForAnyMemory() {
    WorkerPoolConfig config = new WorkerPoolConfig(2, 6, 1.0, 1.0);
    for (double gb = -4; gb <= 64; gb += 0.25) {
      for (int cpus = 1; cpus <= 32; cpus++) {
        int workers = WorkerPoolSizer.computeWorkers(gb, cpus, config);
        assertThat(workers).isGreaterThanOrEqualTo(2);
        assertThat(workers).isLessThanOrEqualTo(Math.max(2, Math.min(cpus, 6)));
      }
    }
  }

  @Test
  void workerPoolConfig_shouldRejectCapBelowMinimum() {
    assertThatThrownBy(() -> new WorkerPoolConfig(4, 2, 1.0, 0.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void optimalWorkers_shouldReadFreshTelemetryEveryCall() {
    when(telemetry.snapshot())
        .thenReturn(snapshot(32.0, 50.0, 8))
        .thenReturn(snapshot(3.5, 95.0, 8));

    assertThat(sizer.optimalWorkers()).isEqualTo(8);
    assertThat(sizer.optimalWorkers()).isEqualTo(1);
    verify(telemetry, times(2)).snapshot();
  }

  @Test
  void isUnderMemoryPressure_shouldCompareAgainstThreshold() {
    when(telemetry.snapshot()).thenReturn(snapshot(8, 86.0, 4)).thenReturn(snapshot(8, 85.0, 4));

    assertThat(sizer.isUnderMemoryPressure()).isTrue();
    assertThat(sizer.isUnderMemoryPressure()).isFalse();
  }

  @Test
  void recommendations_shouldFlagCriticalLowMemoryAndWorkerLimit() {
    when(telemetry.snapshot()).thenReturn(snapshot(1.5, 95.0, 8));

    assertThat(sizer.recommendations())
        .containsOnlyKeys("critical", "low_memory", "worker_limit");
  }

  @Test
  void recommendations_shouldWarnAboveEightyPercent() {
    when(telemetry.snapshot()).thenReturn(snapshot(32.0, 82.0, 4));

    assertThat(sizer.recommendations()).containsOnlyKeys("warning");
  }

  @Test
  void recommendations_shouldBeEmptyWhenHealthy() {
    when(telemetry.snapshot()).thenReturn(snapshot(32.0, 40.0, 4));

    assertThat(sizer.recommendations()).isEmpty();
  }

  private static MemorySnapshot snapshot(double availableGb, double usedPercent, int cpus) {
    return new MemorySnapshot(64.0, availableGb, usedPercent, 256.0, cpus);
  }
}
