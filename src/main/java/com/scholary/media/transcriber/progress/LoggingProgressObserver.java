package com.scholary.media.transcriber.progress;

import com.scholary.media.transcriber.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes each progress snapshot as a structured log event. */
@Component
public class LoggingProgressObserver implements ProgressObserver {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressObserver.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  @Override
  public void emit(String sessionId, SessionProgress progress) {
    structuredLogger.logSessionProgress(
        sessionId,
        progress.status().value(),
        progress.stage().value(),
        progress.progress(),
        progress.chunksCompleted(),
        progress.chunksTotal(),
        progress.currentTask());
  }
}
