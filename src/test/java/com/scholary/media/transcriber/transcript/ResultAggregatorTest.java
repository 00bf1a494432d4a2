package com.scholary.media.transcriber.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.media.transcriber.chunking.ChunkSpec;
import com.scholary.media.transcriber.chunking.TimeRange;
import com.scholary.media.transcriber.transcription.ChunkError;
import com.scholary.media.transcriber.transcription.ChunkError.Stage;
import com.scholary.media.transcriber.transcription.ChunkResult;
import com.scholary.media.transcriber.transcription.Segment;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ResultAggregatorTest {

  private final ResultAggregator aggregator = new ResultAggregator();

  private final List<ChunkSpec> plan =
      List.of(spec(0, 0, 300), spec(1, 300, 300), spec(2, 600, 50));

  @Test
  void aggregate_shouldOrderChunksByStartTime() {
    List<ChunkResult> results =
        List.of(success(2, 600, "third"), success(0, 0, "first"), success(1, 300, "second"));

    MergedTranscript merged = aggregator.aggregate(results, plan);

    assertThat(merged.transcriptText())
        .isEqualTo(
            "\n\n--- m_part_000.mp4 [00:00:00] ---\n\nfirst"
                + "\n"
                + "\n\n--- m_part_001.mp4 [00:05:00] ---\n\nsecond"
                + "\n"
                + "\n\n--- m_part_002.mp4 [00:10:00] ---\n\nthird");
    assertThat(merged.segments())
        .extracting(Segment::text)
        .containsExactly("first", "second", "third");
    assertThat(merged.chunksMerged()).isEqualTo(3);
    assertThat(merged.coverageGaps()).isEmpty();
  }

  @Test
  void aggregate_shouldNotDependOnArrivalOrder() {
    List<ChunkResult> results =
        new ArrayList<>(
            List.of(
                success(0, 0, "alpha beta"),
                success(1, 300, "gamma"),
                failure(2, 600),
                success(3, 900, "delta epsilon zeta")));
    MergedTranscript expected = aggregator.aggregate(results, plan);

    Random random = new Random(42);
    for (int i = 0; i < 20; i++) {
      Collections.shuffle(results, random);
      MergedTranscript actual = aggregator.aggregate(results, plan);
      assertThat(actual).isEqualTo(expected);
    }
  }

  @Test
  void aggregate_shouldSkipFailedChunksAndReportGap() {
    List<ChunkResult> results =
        List.of(success(0, 0, "chunk zero"), failure(1, 300), success(2, 600, "chunk two"));

    MergedTranscript merged = aggregator.aggregate(results, plan);

    assertThat(merged.transcriptText()).contains("chunk zero").contains("chunk two");
    assertThat(merged.transcriptText().indexOf("chunk zero"))
        .isLessThan(merged.transcriptText().indexOf("chunk two"));
    assertThat(merged.transcriptText()).doesNotContain("m_part_001");
    assertThat(merged.chunksMerged()).isEqualTo(2);
    assertThat(merged.coverageGaps()).containsExactly(new TimeRange(300, 600));
  }

  @Test
  void aggregate_shouldMergeAdjacentGaps() {
    List<ChunkResult> results = List.of(success(0, 0, "only"));

    MergedTranscript merged = aggregator.aggregate(results, plan);

    assertThat(merged.coverageGaps()).containsExactly(new TimeRange(300, 650));
  }

  @Test
  void aggregate_shouldCountWhitespaceTokens() {
    MergedTranscript merged = aggregator.aggregate(List.of(success(0, 0, "one two  three")), plan);

    // "---", chunk name, "[00:00:00]", "---" plus three words
    assertThat(merged.totalWords()).isEqualTo(7);
  }

  @Test
  void aggregate_shouldRejectSegmentWithoutText() {
    ChunkResult broken =
        ChunkResult.succeeded(
            0, 0, "m_part_000.mp4", List.of(new Segment(0, 1, null, "00:00:00")), "x");

    assertThatThrownBy(() -> aggregator.aggregate(List.of(broken), plan))
        .isInstanceOf(IllegalStateException.class);
  }

  private static ChunkSpec spec(int index, double start, double duration) {
    return new ChunkSpec(
        index, start, duration, Paths.get(String.format("/tmp/m_part_%03d.mp4", index)));
  }

  private static ChunkResult success(int index, double start, String text) {
    return ChunkResult.succeeded(
        index,
        start,
        String.format("m_part_%03d.mp4", index),
        List.of(Segment.of(start, start + 5, text)),
        text);
  }

  private static ChunkResult failure(int index, double start) {
    return ChunkResult.failed(
        String.format("m_part_%03d.mp4", index),
        new ChunkError(index, start, Stage.TRANSCRIPTION, "model error"));
  }
}
