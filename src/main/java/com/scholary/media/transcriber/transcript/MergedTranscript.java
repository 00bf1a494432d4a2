package com.scholary.media.transcriber.transcript;

import com.scholary.media.transcriber.chunking.TimeRange;
import com.scholary.media.transcriber.transcription.Segment;
import java.util.List;

/**
 * A session's transcript reassembled from its chunk results.
 *
 * @param transcriptText labelled chunk blocks in time order
 * @param segments every segment, in time order
 * @param totalWords whitespace-separated tokens in {@code transcriptText}
 * @param chunksMerged successful chunks included
 * @param coverageGaps parts of the source with no transcript, merged where adjacent
 */
public record MergedTranscript(
    String transcriptText,
    List<Segment> segments,
    int totalWords,
    int chunksMerged,
    List<TimeRange> coverageGaps) {

  public MergedTranscript {
    segments = List.copyOf(segments);
    coverageGaps = List.copyOf(coverageGaps);
  }
}
