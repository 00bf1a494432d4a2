package com.scholary.media.transcriber.transcription;

import java.util.List;

/**
 * Outcome of transcribing one chunk.
 *
 * <p>Exactly one of the two shapes: a success carries segments and text and no error, a failure
 * carries an error and nothing else.
 */
public record ChunkResult(
    int chunkIndex,
    double startTime,
    String chunkName,
    List<Segment> segments,
    String transcriptText,
    ChunkError error) {

  public ChunkResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static ChunkResult succeeded(
      int chunkIndex,
      double startTime,
      String chunkName,
      List<Segment> segments,
      String transcriptText) {
    return new ChunkResult(chunkIndex, startTime, chunkName, segments, transcriptText, null);
  }

  public static ChunkResult failed(String chunkName, ChunkError error) {
    return new ChunkResult(
        error.chunkIndex(), error.startTime(), chunkName, List.of(), null, error);
  }

  public boolean success() {
    return error == null;
  }
}
