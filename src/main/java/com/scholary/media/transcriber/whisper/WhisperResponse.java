package com.scholary.media.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains the full text, a list of segments and the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(String text, List<TranscriptSegment> segments, String language) {

  public WhisperResponse {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  /**
   * The full text, falling back to the joined segment texts when the service omits it.
   */
  public String fullText() {
    if (text != null) {
      return text;
    }
    StringBuilder sb = new StringBuilder();
    for (TranscriptSegment segment : segments) {
      if (segment.text() == null || segment.text().isBlank()) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(segment.text().strip());
    }
    return sb.toString();
  }
}
