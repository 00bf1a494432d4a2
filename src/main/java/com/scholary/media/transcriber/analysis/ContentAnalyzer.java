package com.scholary.media.transcriber.analysis;

import com.scholary.media.transcriber.transcription.Segment;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Pattern-based analysis of a finished transcript.
 *
 * <p>Finds keyword occurrences with surrounding context, counts keyword frequency, and flags
 * segments that look like questions or emphasis cues. Patterns are compiled once; {@link #analyze}
 * keeps no state between calls and never modifies its inputs.
 */
@Component
public class ContentAnalyzer {

  private static final Pattern WORD =
      Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private final int contextWindow;
  private final int maxMatchesPerKeyword;
  private final List<Pattern> questionPatterns;
  private final List<Pattern> emphasisPatterns;

  public ContentAnalyzer(AnalysisProperties properties) {
    this.contextWindow = properties.contextWindowChars();
    this.maxMatchesPerKeyword = properties.maxMatchesPerKeyword();
    this.questionPatterns = compile(properties.questionPatterns());
    this.emphasisPatterns = compile(properties.emphasisPatterns());
  }

  /**
   * Analyze a transcript.
   *
   * @param transcriptText the merged transcript
   * @param segments the transcript's segments, in time order
   * @param keywords keywords to look for; blanks and duplicates are skipped
   * @return the findings
   */
  public AnalysisResult analyze(
      String transcriptText, List<Segment> segments, List<String> keywords) {
    String text = transcriptText == null ? "" : transcriptText;
    List<String> keywordSnapshot = normalize(keywords);

    List<KeywordMatch> matches = new ArrayList<>();
    for (String keyword : keywordSnapshot) {
      KeywordMatch match = findMatches(text, keyword);
      if (match.count() > 0) {
        matches.add(match);
      }
    }

    Map<String, Integer> wordCounts = wordCounts(text);
    Map<String, Integer> frequency = new LinkedHashMap<>();
    for (String keyword : keywordSnapshot) {
      Integer count = wordCounts.get(keyword.toLowerCase(Locale.ROOT));
      if (count != null) {
        frequency.put(keyword, count);
      }
    }

    List<FlaggedSegment> questions = new ArrayList<>();
    List<FlaggedSegment> emphasis = new ArrayList<>();
    for (Segment segment : segments) {
      if (segment.text() == null) {
        continue;
      }
      if (anyMatches(questionPatterns, segment.text())) {
        questions.add(flag(segment));
      }
      if (anyMatches(emphasisPatterns, segment.text())) {
        emphasis.add(flag(segment));
      }
    }

    return new AnalysisResult(matches, frequency, questions, emphasis, countWords(text));
  }

  private KeywordMatch findMatches(String text, String keyword) {
    Pattern pattern =
        Pattern.compile(
            ".{0," + contextWindow + "}" + Pattern.quote(keyword) + ".{0," + contextWindow + "}",
            FLAGS);
    Matcher matcher = pattern.matcher(text);
    List<String> excerpts = new ArrayList<>();
    int count = 0;
    while (matcher.find()) {
      count++;
      if (excerpts.size() < maxMatchesPerKeyword) {
        excerpts.add(matcher.group());
      }
    }
    return new KeywordMatch(keyword, excerpts, count);
  }

  private static Map<String, Integer> wordCounts(String text) {
    Map<String, Integer> counts = new HashMap<>();
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      counts.merge(matcher.group(), 1, Integer::sum);
    }
    return counts;
  }

  /** First match wins, so order only matters for cost. */
  private static boolean anyMatches(List<Pattern> patterns, String text) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }

  private static FlaggedSegment flag(Segment segment) {
    return new FlaggedSegment(segment.displayTimestamp(), segment.text().strip(), segment.start());
  }

  private static List<String> normalize(List<String> keywords) {
    if (keywords == null) {
      return List.of();
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String keyword : keywords) {
      if (keyword != null && !keyword.isBlank()) {
        unique.add(keyword.strip());
      }
    }
    return List.copyOf(unique);
  }

  private static List<Pattern> compile(List<String> regexes) {
    List<Pattern> compiled = new ArrayList<>(regexes.size());
    for (String regex : regexes) {
      compiled.add(Pattern.compile(regex, FLAGS));
    }
    return List.copyOf(compiled);
  }

  private static int countWords(String text) {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
