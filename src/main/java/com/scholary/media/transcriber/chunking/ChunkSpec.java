package com.scholary.media.transcriber.chunking;

import java.nio.file.Path;

/**
 * One planned chunk of the source media.
 *
 * @param index zero-based position in the plan
 * @param startTime offset of the chunk in the source, in seconds
 * @param duration length of the chunk in seconds
 * @param outputPath where the extracted chunk file is written
 */
public record ChunkSpec(int index, double startTime, double duration, Path outputPath) {

  public ChunkSpec {
    if (index < 0) {
      throw new IllegalArgumentException("Chunk index cannot be negative");
    }
    if (startTime < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (duration <= 0) {
      throw new IllegalArgumentException("Chunk duration must be positive");
    }
  }

  public double end() {
    return startTime + duration;
  }

  public TimeRange range() {
    return new TimeRange(startTime, end());
  }

  /** File name of the chunk, used as the transcript block label. */
  public String chunkName() {
    return outputPath.getFileName().toString();
  }
}
