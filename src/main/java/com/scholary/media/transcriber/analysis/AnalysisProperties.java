package com.scholary.media.transcriber.analysis;

import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for content analysis.
 *
 * <p>Pattern lists are ordered: the first pattern that matches a segment wins. {@code keywords} is
 * the default keyword list used when a request does not bring its own.
 */
@ConfigurationProperties(prefix = "analysis")
@Validated
public record AnalysisProperties(
    @Positive int contextWindowChars,
    @Positive int maxMatchesPerKeyword,
    List<String> questionPatterns,
    List<String> emphasisPatterns,
    List<String> keywords) {

  static final List<String> DEFAULT_QUESTION_PATTERNS =
      List.of(
          "\\?", "\\bwhat\\b", "\\bhow\\b", "\\bwhy\\b", "\\bwhen\\b", "\\bwhere\\b",
          "\\bwho\\b");

  static final List<String> DEFAULT_EMPHASIS_PATTERNS =
      List.of(
          "\\bmake sure\\b",
          "\\bdon't forget\\b",
          "\\bremember\\b",
          "\\bimportant\\b",
          "\\bnote that\\b",
          "\\bpay attention\\b",
          "\\bkeep in mind\\b");

  public AnalysisProperties {
    questionPatterns =
        questionPatterns == null || questionPatterns.isEmpty()
            ? DEFAULT_QUESTION_PATTERNS
            : List.copyOf(questionPatterns);
    emphasisPatterns =
        emphasisPatterns == null || emphasisPatterns.isEmpty()
            ? DEFAULT_EMPHASIS_PATTERNS
            : List.copyOf(emphasisPatterns);
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  /** Defaults: 50 character context window, 100 excerpts per keyword, built-in patterns. */
  public static AnalysisProperties defaults() {
    return new AnalysisProperties(50, 100, null, null, null);
  }
}
