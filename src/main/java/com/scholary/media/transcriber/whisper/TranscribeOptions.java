package com.scholary.media.transcriber.whisper;

import java.time.Duration;

/**
 * Per-call options for a speech-to-text request.
 *
 * @param wordTimestamps whether word-level timestamps are requested
 * @param timeout upper bound for the whole call, retries included
 * @param chunkIndex index of the chunk being transcribed, for logging
 */
public record TranscribeOptions(boolean wordTimestamps, Duration timeout, int chunkIndex) {

  public TranscribeOptions {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Timeout must be positive");
    }
  }

  public static TranscribeOptions withWordTimestamps(Duration timeout, int chunkIndex) {
    return new TranscribeOptions(true, timeout, chunkIndex);
  }
}
