package com.scholary.media.transcriber.analysis;

import java.util.List;

/**
 * Occurrences of one keyword in the transcript.
 *
 * @param keyword the keyword as configured
 * @param matches excerpts with surrounding context, possibly capped
 * @param count total number of occurrences, never capped
 */
public record KeywordMatch(String keyword, List<String> matches, int count) {

  public KeywordMatch {
    matches = List.copyOf(matches);
  }
}
