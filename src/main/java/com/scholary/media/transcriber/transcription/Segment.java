package com.scholary.media.transcriber.transcription;

import com.scholary.media.transcriber.transcript.Timestamps;

/**
 * A transcribed segment positioned on the source media's timeline.
 *
 * @param start absolute start in seconds
 * @param end absolute end in seconds
 * @param text segment text, trimmed
 * @param displayTimestamp {@code HH:MM:SS} of {@code start}
 */
public record Segment(double start, double end, String text, String displayTimestamp) {

  public static Segment of(double start, double end, String text) {
    return new Segment(start, end, text == null ? null : text.strip(), Timestamps.format(start));
  }
}
