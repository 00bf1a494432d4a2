package com.scholary.media.transcriber.progress;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Pipeline stage a session is in. */
public enum ProcessingStage {
  INITIALIZATION,
  ANALYSIS,
  PREPARATION,
  TRANSCRIPTION,
  POST_PROCESSING,
  FINALIZATION,
  COMPLETED,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
