package com.scholary.media.transcriber.progress;

/** Receives progress snapshots. Called on the progress emitter thread, never under a lock. */
@FunctionalInterface
public interface ProgressObserver {

  void emit(String sessionId, SessionProgress progress);
}
