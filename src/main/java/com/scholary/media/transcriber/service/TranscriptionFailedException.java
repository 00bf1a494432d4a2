package com.scholary.media.transcriber.service;

/** Thrown when a session ends in error. No partial result is available. */
public class TranscriptionFailedException extends RuntimeException {

  private final String sessionId;

  public TranscriptionFailedException(String sessionId, String message, Throwable cause) {
    super(message, cause);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
