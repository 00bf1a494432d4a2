package com.scholary.media.transcriber.files;

/** Outcome of a cleanup pass. */
public record CleanupReport(int filesRemoved, long bytesReclaimed) {

  public static final CleanupReport EMPTY = new CleanupReport(0, 0);

  public CleanupReport plus(CleanupReport other) {
    return new CleanupReport(
        filesRemoved + other.filesRemoved, bytesReclaimed + other.bytesReclaimed);
  }
}
