package com.scholary.media.transcriber.progress;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Tracks the progress of running sessions and publishes every change.
 *
 * <p>Sessions move {@code starting -> processing -> completed | error}. Once a session is terminal
 * further updates are ignored. Each session has its own lock; snapshots are handed to the {@link
 * ProgressObserver} through the emitter executor after the lock is released, so a slow observer
 * never holds up the pipeline and an observer failure never reaches it.
 *
 * <p>Every snapshot carries a per-session sequence number taken under the lock. A snapshot that
 * reaches the emitter after a newer one of the same session is dropped, so the observer only ever
 * sees a session move forward.
 *
 * <p>Sessions are held in a bounded cache and expire after a period without access.
 */
@Component
public class ProgressTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);

  private static final double TRANSCRIPTION_BASE = 20.0;
  private static final double TRANSCRIPTION_SPAN = 70.0;

  private final ProgressObserver observer;
  private final Executor emitter;
  private final Clock clock;
  private final Cache<String, SessionState> sessions;

  public ProgressTracker(
      ProgressObserver observer,
      @Qualifier("progressEmitter") Executor emitter,
      Clock clock,
      ProgressProperties properties) {
    this.observer = observer;
    this.emitter = emitter;
    this.clock = clock;
    this.sessions =
        Caffeine.newBuilder()
            .maximumSize(properties.maxSessions())
            .expireAfterAccess(Duration.ofMinutes(properties.sessionRetentionMinutes()))
            .build();
  }

  /** Start tracking a session. An existing session with the same id is replaced. */
  public void startSession(String sessionId, int totalChunks, double mediaDuration) {
    SessionState state =
        new SessionState(
            SessionProgress.starting(sessionId, totalChunks, mediaDuration, clock.instant()));
    sessions.put(sessionId, state);
    LOGGER.info("Started progress tracking for session {}", sessionId);
    emit(state, state.current, 0);
  }

  /** Merge an update into the session and recompute the time estimate. */
  public void updateProgress(String sessionId, ProgressUpdate update) {
    apply(sessionId, current -> withEstimate(update.applyTo(current)));
  }

  /**
   * Record chunk completion.
   *
   * <p>Transcription covers 20 to 90 percent of overall progress in proportion to {@code
   * completed / total}.
   */
  public void updateChunkProgress(String sessionId, int completed, int total, String label) {
    apply(
        sessionId,
        current ->
            chunkProgress(current, Math.max(current.chunksCompleted(), completed), total, label));
  }

  /**
   * Count one more completed chunk.
   *
   * <p>The count is read and incremented under the session lock, so callbacks racing on several
   * worker threads never lose an increment or move the count backwards.
   */
  public void recordChunkCompleted(String sessionId, int total, String label) {
    apply(
        sessionId, current -> chunkProgress(current, current.chunksCompleted() + 1, total, label));
  }

  private SessionProgress chunkProgress(
      SessionProgress current, int completed, int total, String label) {
    double fraction = total > 0 ? Math.min(1.0, (double) completed / total) : 0.0;
    String task = "Processing chunk " + completed + "/" + total;
    if (label != null && !label.isBlank()) {
      task += " - " + label;
    }
    ProgressUpdate update =
        ProgressUpdate.builder()
            .stage(ProcessingStage.TRANSCRIPTION)
            .progress(TRANSCRIPTION_BASE + fraction * TRANSCRIPTION_SPAN)
            .chunksCompleted(completed)
            .chunksTotal(total)
            .currentTask(task)
            .build();
    return withEstimate(update.applyTo(current));
  }

  /**
   * Move the session to its terminal state.
   *
   * @param success true for {@code completed} at 100 percent, false for {@code error} with
   *     progress left where it was
   * @param message shown as the current task and kept as the terminal message
   */
  public void completeSession(String sessionId, boolean success, String message) {
    apply(
        sessionId,
        current ->
            new SessionProgress(
                current.sessionId(),
                success ? SessionStatus.COMPLETED : SessionStatus.ERROR,
                success ? ProcessingStage.COMPLETED : ProcessingStage.ERROR,
                success ? 100.0 : current.progress(),
                message,
                current.chunksTotal(),
                current.chunksCompleted(),
                current.currentChunk(),
                current.startTime(),
                success ? Duration.ZERO : null,
                current.mediaDuration(),
                message));
    LOGGER.info("Session {} marked as {}", sessionId, success ? "completed" : "failed");
  }

  public Optional<SessionProgress> getSessionProgress(String sessionId) {
    SessionState state = sessions.getIfPresent(sessionId);
    if (state == null) {
      return Optional.empty();
    }
    state.lock.lock();
    try {
      return Optional.of(state.current);
    } finally {
      state.lock.unlock();
    }
  }

  public void cleanupSession(String sessionId) {
    sessions.invalidate(sessionId);
    LOGGER.debug("Cleaned up progress tracking for session {}", sessionId);
  }

  /** Snapshot of every tracked session, terminal ones included. */
  public Map<String, SessionProgress> activeSessions() {
    Map<String, SessionProgress> snapshot = new LinkedHashMap<>();
    sessions
        .asMap()
        .forEach(
            (id, state) -> {
              state.lock.lock();
              try {
                snapshot.put(id, state.current);
              } finally {
                state.lock.unlock();
              }
            });
    return snapshot;
  }

  /**
   * Drop sessions started more than {@code maxAge} ago.
   *
   * @return number of sessions removed
   */
  public int cleanupStaleSessions(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    List<String> stale = new ArrayList<>();
    for (Map.Entry<String, SessionProgress> entry : activeSessions().entrySet()) {
      if (entry.getValue().startTime().isBefore(cutoff)) {
        stale.add(entry.getKey());
      }
    }
    sessions.invalidateAll(stale);
    if (!stale.isEmpty()) {
      LOGGER.info("Cleaned up {} stale progress sessions", stale.size());
    }
    return stale.size();
  }

  private void apply(String sessionId, UnaryOperator<SessionProgress> change) {
    SessionState state = sessions.getIfPresent(sessionId);
    if (state == null) {
      LOGGER.warn("Attempted to update non-existent session: {}", sessionId);
      return;
    }

    SessionProgress updated;
    long sequence;
    state.lock.lock();
    try {
      if (state.current.status().isTerminal()) {
        LOGGER.debug(
            "Ignoring update for session {} already {}", sessionId, state.current.status().value());
        return;
      }
      updated = change.apply(state.current);
      state.current = updated;
      sequence = ++state.sequence;
    } finally {
      state.lock.unlock();
    }

    LOGGER.debug(
        "Progress update for {}: {} ({}%)",
        sessionId, updated.currentTask(), String.format("%.1f", updated.progress()));
    emit(state, updated, sequence);
  }

  private SessionProgress withEstimate(SessionProgress progress) {
    double p = progress.progress();
    if (p <= 0 || p >= 100) {
      return progress;
    }
    long elapsedMs = Duration.between(progress.startTime(), clock.instant()).toMillis();
    long remainingMs = Math.max(0, (long) (elapsedMs * (100.0 - p) / p));
    return new SessionProgress(
        progress.sessionId(),
        progress.status(),
        progress.stage(),
        progress.progress(),
        progress.currentTask(),
        progress.chunksTotal(),
        progress.chunksCompleted(),
        progress.currentChunk(),
        progress.startTime(),
        Duration.ofMillis(remainingMs),
        progress.mediaDuration(),
        progress.message());
  }

  private void emit(SessionState state, SessionProgress snapshot, long sequence) {
    try {
      emitter.execute(
          () -> {
            if (state.lastEmitted.getAndAccumulate(sequence, Math::max) > sequence) {
              LOGGER.trace(
                  "Dropping stale progress #{} for session {}", sequence, snapshot.sessionId());
              return;
            }
            try {
              observer.emit(snapshot.sessionId(), snapshot);
            } catch (RuntimeException e) {
              LOGGER.warn("Failed to emit progress for session {}", snapshot.sessionId(), e);
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Progress emission rejected for session {}", snapshot.sessionId(), e);
    }
  }

  private static final class SessionState {
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong lastEmitted = new AtomicLong(-1);
    private SessionProgress current;
    private long sequence;

    private SessionState(SessionProgress initial) {
      this.current = initial;
    }
  }
}
