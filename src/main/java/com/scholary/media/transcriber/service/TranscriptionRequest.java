package com.scholary.media.transcriber.service;

import java.nio.file.Path;
import java.util.List;

/**
 * A request to transcribe one media file.
 *
 * @param inputPath the media file
 * @param sessionName prefix for the session id, or null to use the file name
 * @param keywords keywords for content analysis, or null for the configured defaults
 * @param chunkSeconds requested chunk length, or null for the configured default
 */
public record TranscriptionRequest(
    Path inputPath, String sessionName, List<String> keywords, Integer chunkSeconds) {

  public TranscriptionRequest {
    if (inputPath == null) {
      throw new IllegalArgumentException("inputPath is required");
    }
    keywords = keywords == null ? null : List.copyOf(keywords);
  }

  public static TranscriptionRequest of(Path inputPath) {
    return new TranscriptionRequest(inputPath, null, null, null);
  }
}
