package com.scholary.media.transcriber.transcript;

import com.scholary.media.transcriber.chunking.ChunkSpec;
import com.scholary.media.transcriber.chunking.TimeRange;
import com.scholary.media.transcriber.transcription.ChunkResult;
import com.scholary.media.transcriber.transcription.Segment;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges chunk results into one time-ordered transcript.
 *
 * <p>Chunk results arrive in completion order. Failed results are left out, the rest are sorted by
 * start time (chunk index breaks ties), so the output does not depend on the order results
 * arrived in.
 *
 * <p>Transcript format, one block per chunk, blocks joined by a newline:
 *
 * <pre>
 *
 *
 * --- lecture_part_000.mp4 [00:00:00] ---
 *
 * chunk text
 * </pre>
 */
@Component
public class ResultAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultAggregator.class);

  private static final Comparator<ChunkResult> TIME_ORDER =
      Comparator.comparingDouble(ChunkResult::startTime).thenComparingInt(ChunkResult::chunkIndex);

  /**
   * Merge chunk results.
   *
   * @param results chunk results in any order
   * @param plan the full chunk plan, used to report uncovered time ranges
   * @return the merged transcript
   * @throws IllegalStateException if a successful result holds a segment without text
   */
  public MergedTranscript aggregate(Collection<ChunkResult> results, List<ChunkSpec> plan) {
    List<ChunkResult> successful = new ArrayList<>();
    for (ChunkResult result : results) {
      if (result.success()) {
        successful.add(result);
      }
    }
    successful.sort(TIME_ORDER);

    List<String> blocks = new ArrayList<>(successful.size());
    List<Segment> segments = new ArrayList<>();
    for (ChunkResult result : successful) {
      for (Segment segment : result.segments()) {
        if (segment.text() == null) {
          throw new IllegalStateException(
              "Segment without text in chunk " + result.chunkIndex() + " at " + segment.start());
        }
        segments.add(segment);
      }
      blocks.add(
          "\n\n--- "
              + result.chunkName()
              + " ["
              + Timestamps.format(result.startTime())
              + "] ---\n\n"
              + (result.transcriptText() == null ? "" : result.transcriptText()));
    }

    String transcript = String.join("\n", blocks);
    List<TimeRange> gaps = coverageGaps(successful, plan);
    if (!gaps.isEmpty()) {
      LOGGER.warn("Transcript has {} uncovered time ranges: {}", gaps.size(), gaps);
    }

    return new MergedTranscript(
        transcript, segments, countWords(transcript), successful.size(), gaps);
  }

  static int countWords(String text) {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  /** Planned ranges not covered by a successful chunk, adjacent ranges merged. */
  static List<TimeRange> coverageGaps(List<ChunkResult> successful, List<ChunkSpec> plan) {
    Set<Integer> covered = new HashSet<>();
    for (ChunkResult result : successful) {
      covered.add(result.chunkIndex());
    }

    List<ChunkSpec> ordered = new ArrayList<>(plan);
    ordered.sort(Comparator.comparingDouble(ChunkSpec::startTime));

    List<TimeRange> gaps = new ArrayList<>();
    for (ChunkSpec spec : ordered) {
      if (covered.contains(spec.index())) {
        continue;
      }
      TimeRange range = spec.range();
      int last = gaps.size() - 1;
      if (last >= 0 && gaps.get(last).touches(range)) {
        gaps.set(last, gaps.get(last).span(range));
      } else {
        gaps.add(range);
      }
    }
    return gaps;
  }
}
