package com.scholary.media.transcriber.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TimestampsTest {

  @Test
  void format_shouldTruncateFractions() {
    assertThat(Timestamps.format(0)).isEqualTo("00:00:00");
    assertThat(Timestamps.format(59.99)).isEqualTo("00:00:59");
    assertThat(Timestamps.format(600.5)).isEqualTo("00:10:00");
    assertThat(Timestamps.format(3725)).isEqualTo("01:02:05");
  }

  @Test
  void format_shouldNotWrapHours() {
    assertThat(Timestamps.format(36_000)).isEqualTo("10:00:00");
    assertThat(Timestamps.format(100 * 3600 + 1)).isEqualTo("100:00:01");
  }
}
