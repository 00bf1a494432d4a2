package com.scholary.media.transcriber.whisper;

/**
 * Exception thrown when Whisper API calls fail.
 *
 * <p>This could be due to network issues, service unavailability, timeouts or invalid responses.
 */
public class WhisperException extends RuntimeException {

  public WhisperException(String message) {
    super(message);
  }

  public WhisperException(String message, Throwable cause) {
    super(message, cause);
  }
}
