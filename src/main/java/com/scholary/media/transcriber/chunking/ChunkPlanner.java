package com.scholary.media.transcriber.chunking;

import com.scholary.media.transcriber.config.TranscriptionProperties;
import com.scholary.media.transcriber.config.TranscriptionProperties.ChunkingProperties;
import com.scholary.media.transcriber.logging.StructuredLogger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Plans fixed-length chunks over a media duration.
 *
 * <p>The chunk length adapts to the media: short recordings get shorter chunks so they still
 * spread across workers, long recordings get longer ones to keep the chunk count down. The plan
 * covers {@code [0, duration)} with contiguous, non-overlapping chunks; the last one holds the
 * remainder.
 *
 * <p>Planning is pure. Output paths are computed here and created later by the extractor.
 */
@Component
public class ChunkPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ChunkingProperties chunking;

  public ChunkPlanner(TranscriptionProperties properties) {
    this.chunking = properties.chunking();
  }

  /**
   * Plan chunks for a media file.
   *
   * @param durationSeconds total media duration, must be positive
   * @param requestedChunkSeconds chunk length asked for by the caller, or null for the default
   * @param outputDir directory the chunk files will be written to
   * @param baseName base of the chunk file names
   * @param extension chunk file extension, without the dot
   * @return the ordered chunk plan
   * @throws DurationUnknownException if the duration is missing or not positive
   */
  public List<ChunkSpec> plan(
      Double durationSeconds,
      Integer requestedChunkSeconds,
      Path outputDir,
      String baseName,
      String extension) {

    if (durationSeconds == null
        || durationSeconds.isNaN()
        || durationSeconds.isInfinite()
        || durationSeconds <= 0) {
      throw new DurationUnknownException("Could not determine media duration: " + durationSeconds);
    }

    double duration = durationSeconds;
    int chunkSeconds = effectiveChunkSeconds(duration, requestedChunkSeconds);
    int count = (int) Math.ceil(duration / chunkSeconds);

    List<ChunkSpec> specs = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      double start = (double) i * chunkSeconds;
      double length = Math.min(chunkSeconds, duration - start);
      Path output = outputDir.resolve(String.format("%s_part_%03d.%s", baseName, i, extension));
      specs.add(new ChunkSpec(i, start, length, output));
      structuredLogger.logChunkPlanned(i, start, length);
    }

    LOGGER.info(
        "Planned {} chunks of {}s for {}s of media", specs.size(), chunkSeconds, duration);
    return specs;
  }

  /**
   * Chunk length for a given media duration.
   *
   * <p>The requested length (or the default) is clamped to the configured bounds, then capped for
   * short and long media.
   */
  public int effectiveChunkSeconds(double durationSeconds, Integer requestedChunkSeconds) {
    int requested =
        requestedChunkSeconds != null ? requestedChunkSeconds : chunking.defaultChunkSeconds();
    int clamped =
        Math.max(chunking.minChunkSeconds(), Math.min(chunking.maxChunkSeconds(), requested));

    if (durationSeconds < chunking.shortMediaThresholdSeconds()) {
      return Math.min(clamped, chunking.shortMediaChunkLimit());
    }
    if (durationSeconds > chunking.longMediaThresholdSeconds()) {
      return Math.min(clamped, chunking.longMediaChunkLimit());
    }
    return clamped;
  }
}
