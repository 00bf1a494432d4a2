package com.scholary.media.transcriber.service;

import com.scholary.media.transcriber.analysis.AnalysisResult;
import com.scholary.media.transcriber.chunking.TimeRange;
import com.scholary.media.transcriber.transcription.ChunkError;
import com.scholary.media.transcriber.transcription.Segment;
import java.util.List;

/**
 * Result of a completed session.
 *
 * <p>{@code failedChunks} and {@code coverageGaps} describe the parts of the source that are
 * missing from {@code transcript}; both are empty when every chunk was transcribed.
 */
public record TranscriptionResult(
    String sessionId,
    String transcript,
    List<Segment> segments,
    AnalysisResult analysis,
    int chunksTotal,
    int chunksCompleted,
    List<ChunkError> failedChunks,
    List<TimeRange> coverageGaps,
    int workersUsed,
    long reclaimedBytes) {

  public TranscriptionResult {
    segments = List.copyOf(segments);
    failedChunks = List.copyOf(failedChunks);
    coverageGaps = List.copyOf(coverageGaps);
  }

  public boolean complete() {
    return failedChunks.isEmpty();
  }
}
