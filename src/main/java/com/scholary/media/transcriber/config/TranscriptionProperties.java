package com.scholary.media.transcriber.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls chunk sizing, stage pool limits, the audio format handed to the speech model, and
 * temporary file limits.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @NotBlank String tempDir,
    @Positive int chunkTimeoutSeconds,
    @Min(1) int maxTrackedFiles,
    @NotNull @Valid ChunkingProperties chunking,
    @NotNull @Valid ExtractionProperties extraction,
    @NotNull @Valid AudioProperties audio) {

  /**
   * Adaptive chunk sizing.
   *
   * <p>Media shorter than {@code shortMediaThresholdSeconds} is cut into chunks of at most {@code
   * shortMediaChunkLimit}; media longer than {@code longMediaThresholdSeconds} into chunks of at
   * most {@code longMediaChunkLimit}.
   */
  public record ChunkingProperties(
      @Positive int defaultChunkSeconds,
      @Positive int minChunkSeconds,
      @Positive int maxChunkSeconds,
      @Positive int shortMediaThresholdSeconds,
      @Positive int shortMediaChunkLimit,
      @Positive int longMediaThresholdSeconds,
      @Positive int longMediaChunkLimit) {

    public ChunkingProperties {
      if (minChunkSeconds >= maxChunkSeconds) {
        throw new IllegalArgumentException("minChunkSeconds must be less than maxChunkSeconds");
      }
      if (shortMediaThresholdSeconds >= longMediaThresholdSeconds) {
        throw new IllegalArgumentException(
            "shortMediaThresholdSeconds must be less than longMediaThresholdSeconds");
      }
    }
  }

  /** Chunk extraction stage: I/O bound, so it may run wider than the transcription pool. */
  public record ExtractionProperties(@Positive int poolCap) {}

  /** Audio handed to the speech model. */
  public record AudioProperties(
      @NotBlank String codec, @Positive int channels, @Positive int sampleRate) {}
}
