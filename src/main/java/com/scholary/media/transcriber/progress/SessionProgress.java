package com.scholary.media.transcriber.progress;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a session's progress.
 *
 * @param progress overall completion, 0 to 100
 * @param chunksCompleted chunks transcribed successfully
 * @param currentChunk chunks finished so far, successful or not
 * @param estimatedTimeRemaining null until there is progress to extrapolate from
 * @param mediaDuration source duration in seconds, 0 while unknown
 * @param message terminal message, null while the session runs
 */
public record SessionProgress(
    String sessionId,
    SessionStatus status,
    ProcessingStage stage,
    double progress,
    String currentTask,
    int chunksTotal,
    int chunksCompleted,
    int currentChunk,
    Instant startTime,
    Duration estimatedTimeRemaining,
    double mediaDuration,
    String message) {

  static SessionProgress starting(
      String sessionId, int chunksTotal, double mediaDuration, Instant startTime) {
    return new SessionProgress(
        sessionId,
        SessionStatus.STARTING,
        ProcessingStage.INITIALIZATION,
        0.0,
        "Initializing...",
        chunksTotal,
        0,
        0,
        startTime,
        null,
        mediaDuration,
        null);
  }
}
