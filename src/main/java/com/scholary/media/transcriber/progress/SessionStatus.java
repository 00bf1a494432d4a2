package com.scholary.media.transcriber.progress;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle status of a session. Ordered: a session only ever moves forward. */
public enum SessionStatus {
  STARTING,
  PROCESSING,
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
