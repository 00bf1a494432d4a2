package com.scholary.media.transcriber.transcript;

/** Formatting of media offsets for display. */
public final class Timestamps {

  private Timestamps() {}

  /**
   * Format seconds as {@code HH:MM:SS}. Fractions are truncated and hours do not wrap, so ten
   * hours of media reads {@code 10:00:00}.
   */
  public static String format(double seconds) {
    long total = (long) Math.max(0, seconds);
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    return String.format("%02d:%02d:%02d", hours, minutes, secs);
  }
}
