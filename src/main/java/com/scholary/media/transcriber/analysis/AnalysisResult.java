package com.scholary.media.transcriber.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Findings of a content analysis pass.
 *
 * <p>{@code keywordFrequency} iterates in keyword order.
 */
public record AnalysisResult(
    List<KeywordMatch> keywordMatches,
    Map<String, Integer> keywordFrequency,
    List<FlaggedSegment> questions,
    List<FlaggedSegment> emphasisCues,
    int totalWords) {

  public AnalysisResult {
    keywordMatches = List.copyOf(keywordMatches);
    keywordFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(keywordFrequency));
    questions = List.copyOf(questions);
    emphasisCues = List.copyOf(emphasisCues);
  }
}
