package com.scholary.media.transcriber.chunking;

/**
 * Represents a time range in seconds with start and end points.
 *
 * <p>Used for chunk boundaries and for the parts of the source a transcript does not cover. All
 * times are in seconds with fractional precision.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Check if this range ends exactly where the other begins, or overlaps it.
   *
   * @param other the range following this one
   * @return true if the two ranges can be merged into one
   */
  public boolean touches(TimeRange other) {
    return this.start <= other.end && other.start <= this.end;
  }

  /** The smallest range covering both. */
  public TimeRange span(TimeRange other) {
    return new TimeRange(Math.min(start, other.start), Math.max(end, other.end));
  }
}
