package com.scholary.media.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts event-specific fields into the MDC for the duration of a single log call, so
 * a JSON encoder or log shipper can index chunk and session events without parsing messages.
 */
public class StructuredLogger {

  public static final String SESSION_ID = "sessionId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk planning event. */
  public void logChunkPlanned(int chunkIndex, double start, double durationSeconds) {
    try {
      MDC.put("event_type", "chunk_planned");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.debug(
          "Chunk planned: index={}, range=[{}-{}], duration={}s",
          chunkIndex,
          start,
          start + durationSeconds,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk extracted event. */
  public void logChunkExtracted(int chunkIndex, double start, long extractMs) {
    try {
      MDC.put("event_type", "chunk_extracted");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("extractMs", String.valueOf(extractMs));

      logger.debug(
          "Chunk extracted: index={}, start={}s, extract={}ms", chunkIndex, start, extractMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int workerId, int chunkIndex, double start, double durationSeconds) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("worker_id", String.valueOf(workerId));
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.debug(
          "Chunk started: worker={}, index={}, range=[{}-{}], duration={}s",
          workerId,
          chunkIndex,
          start,
          start + durationSeconds,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, double start, int segmentCount, long transcribeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("segments", String.valueOf(segmentCount));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Chunk finished: index={}, start={}s, segments={}, transcribe={}ms",
          chunkIndex,
          start,
          segmentCount,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk failure event. */
  public void logChunkFailed(int chunkIndex, double start, String stage, String message) {
    try {
      MDC.put("event_type", "chunk_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("errorType", stage);

      logger.error(
          "Chunk failed: index={}, start={}s, stage={}, message={}",
          chunkIndex,
          start,
          stage,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription retry event. */
  public void logTranscribeRetry(
      int chunkIndex, int attempt, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_retry");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "Transcribe retry: chunk={}, attempt={}/{}, error={}, message={}",
          chunkIndex,
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log session progress event. */
  public void logSessionProgress(
      String sessionId,
      String status,
      String stage,
      double percentComplete,
      int chunksCompleted,
      int chunksTotal,
      String task) {
    try {
      MDC.put("event_type", "session_progress");
      MDC.put("status", status);
      MDC.put("stage", stage);
      MDC.put("percentComplete", String.format("%.1f", percentComplete));
      MDC.put("chunksCompleted", String.valueOf(chunksCompleted));
      MDC.put("chunksTotal", String.valueOf(chunksTotal));

      logger.info(
          "Session progress: sessionId={}, status={}, stage={}, chunks={}/{}, progress={}% - {}",
          sessionId,
          status,
          stage,
          chunksCompleted,
          chunksTotal,
          String.format("%.1f", percentComplete),
          task);
    } finally {
      clearEventFields();
    }
  }

  /** Log temporary file cleanup event. */
  public void logCleanup(String reason, int filesRemoved, long bytesReclaimed) {
    try {
      MDC.put("event_type", "file_cleanup");
      MDC.put("filesRemoved", String.valueOf(filesRemoved));
      MDC.put("bytesReclaimed", String.valueOf(bytesReclaimed));

      logger.info(
          "{}: removed {} temp files ({} MB)",
          reason,
          filesRemoved,
          String.format("%.1f", bytesReclaimed / (1024.0 * 1024.0)));
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String sessionId) {
    MDC.put(SESSION_ID, sessionId);
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove(SESSION_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("worker_id");
    MDC.remove("start");
    MDC.remove("durationSeconds");
    MDC.remove("extractMs");
    MDC.remove("segments");
    MDC.remove("transcribeMs");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("errorType");
    MDC.remove("status");
    MDC.remove("stage");
    MDC.remove("percentComplete");
    MDC.remove("chunksCompleted");
    MDC.remove("chunksTotal");
    MDC.remove("filesRemoved");
    MDC.remove("bytesReclaimed");
  }
}
