package com.scholary.media.transcriber.chunking;

/** Thrown when a chunk plan is requested without a usable media duration. */
public class DurationUnknownException extends RuntimeException {

  public DurationUnknownException(String message) {
    super(message);
  }
}
