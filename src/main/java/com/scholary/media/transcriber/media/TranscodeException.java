package com.scholary.media.transcriber.media;

import java.io.IOException;

/**
 * Thrown when the transcoder fails to write an output file.
 *
 * <p>{@link #isTimeout()} distinguishes a killed, over-deadline process from an ordinary failure.
 */
public class TranscodeException extends IOException {

  private final boolean timeout;

  public TranscodeException(String message) {
    this(message, null, false);
  }

  public TranscodeException(String message, Throwable cause) {
    this(message, cause, false);
  }

  private TranscodeException(String message, Throwable cause, boolean timeout) {
    super(message, cause);
    this.timeout = timeout;
  }

  public static TranscodeException timedOut(String message) {
    return new TranscodeException(message, null, true);
  }

  public boolean isTimeout() {
    return timeout;
  }
}
