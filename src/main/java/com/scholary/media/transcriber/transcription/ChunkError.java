package com.scholary.media.transcriber.transcription;

/**
 * Why a chunk produced no transcript.
 *
 * @param chunkIndex index of the chunk in the plan
 * @param startTime offset of the chunk in the source
 * @param stage where processing stopped
 * @param message failure detail
 */
public record ChunkError(int chunkIndex, double startTime, Stage stage, String message) {

  public enum Stage {
    EXTRACTION,
    AUDIO_EXTRACTION,
    TRANSCRIPTION,
    TIMEOUT,
    CANCELLED
  }
}
