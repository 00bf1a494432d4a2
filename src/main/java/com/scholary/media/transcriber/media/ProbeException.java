package com.scholary.media.transcriber.media;

import java.io.IOException;

/** Thrown when the duration of a media file cannot be determined. */
public class ProbeException extends IOException {

  public ProbeException(String message) {
    super(message);
  }

  public ProbeException(String message, Throwable cause) {
    super(message, cause);
  }
}
