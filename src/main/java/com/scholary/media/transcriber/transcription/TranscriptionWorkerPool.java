package com.scholary.media.transcriber.transcription;

import com.scholary.media.transcriber.chunking.ChunkSpec;
import com.scholary.media.transcriber.concurrent.BoundedExecutors;
import com.scholary.media.transcriber.concurrent.CancellationSignal;
import com.scholary.media.transcriber.config.TranscriptionProperties;
import com.scholary.media.transcriber.files.FileLifecycleManager;
import com.scholary.media.transcriber.logging.StructuredLogger;
import com.scholary.media.transcriber.media.Transcoder;
import com.scholary.media.transcriber.transcription.ChunkError.Stage;
import com.scholary.media.transcriber.whisper.SpeechModelFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Transcribes a session's chunk files in parallel.
 *
 * <p>Starts one long-lived {@link TranscriptionWorker} per pool thread; the workers pull chunks
 * from a shared queue until it is empty. Results come back in completion order. A failed chunk
 * never affects the others.
 *
 * <p>Once the session's {@link CancellationSignal} is raised, chunks still in the queue are
 * reported as {@link Stage#CANCELLED} instead of being transcribed. Chunks already running finish
 * normally.
 */
@Component
public class TranscriptionWorkerPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionWorkerPool.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final SpeechModelFactory modelFactory;
  private final Transcoder transcoder;
  private final TranscriptionProperties properties;

  public TranscriptionWorkerPool(
      SpeechModelFactory modelFactory, Transcoder transcoder, TranscriptionProperties properties) {
    this.modelFactory = modelFactory;
    this.transcoder = transcoder;
    this.properties = properties;
  }

  /**
   * Transcribe every chunk.
   *
   * @param chunks extracted chunks, in any order
   * @param workers upper bound on parallel workers
   * @param files the session's file registry; chunk files are released as they finish
   * @param cancellation the session's cancellation signal
   * @param listener notified on the worker thread after each chunk
   * @return one result per chunk, in completion order
   * @throws CancellationException if the calling thread is interrupted while waiting
   */
  public List<ChunkResult> transcribeAll(
      List<ChunkSpec> chunks,
      int workers,
      FileLifecycleManager files,
      CancellationSignal cancellation,
      ChunkCompletionListener listener) {

    if (chunks.isEmpty()) {
      return List.of();
    }

    int poolSize = Math.max(1, Math.min(workers, chunks.size()));
    int total = chunks.size();
    Duration chunkTimeout = Duration.ofSeconds(properties.chunkTimeoutSeconds());

    Queue<ChunkSpec> queue = new ConcurrentLinkedQueue<>(chunks);
    Queue<ChunkResult> results = new ConcurrentLinkedQueue<>();
    AtomicInteger completed = new AtomicInteger();

    LOGGER.info("Transcribing {} chunks with {} workers", total, poolSize);

    ThreadPoolTaskExecutor executor = BoundedExecutors.fixed("transcribe-", poolSize);
    try {
      List<Future<?>> futures = new ArrayList<>(poolSize);
      for (int i = 0; i < poolSize; i++) {
        TranscriptionWorker worker =
            new TranscriptionWorker(
                i, modelFactory, transcoder, properties.audio(), chunkTimeout, files);
        futures.add(
            executor.submit(
                () -> drain(worker, queue, results, completed, total, cancellation, listener)));
      }

      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (ExecutionException e) {
          LOGGER.error("Transcription worker terminated unexpectedly", e.getCause());
        }
      }
    } catch (InterruptedException e) {
      cancellation.raise("Interrupted");
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for transcription workers");
    } finally {
      executor.shutdown();
    }

    return new ArrayList<>(results);
  }

  private void drain(
      TranscriptionWorker worker,
      Queue<ChunkSpec> queue,
      Queue<ChunkResult> results,
      AtomicInteger completed,
      int total,
      CancellationSignal cancellation,
      ChunkCompletionListener listener) {

    ChunkSpec spec;
    while ((spec = queue.poll()) != null) {
      ChunkResult result;
      if (cancellation.isRaised()) {
        result = cancelled(spec, cancellation.reason());
      } else {
        result = processSafely(worker, spec);
      }
      results.add(result);
      int done = completed.incrementAndGet();
      try {
        listener.onChunkCompleted(result, done, total);
      } catch (RuntimeException e) {
        LOGGER.warn("Chunk completion listener failed for chunk {}", spec.index(), e);
      }
    }
  }

  /** A chunk that blows up in an unexpected way still yields a result; the worker moves on. */
  private ChunkResult processSafely(TranscriptionWorker worker, ChunkSpec spec) {
    try {
      return worker.process(spec);
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure transcribing chunk {}", spec.index(), e);
      return worker.fail(spec, Stage.TRANSCRIPTION, "Unexpected error: " + e);
    }
  }

  private ChunkResult cancelled(ChunkSpec spec, String reason) {
    String message = "Cancelled" + (reason != null ? ": " + reason : "");
    structuredLogger.logChunkFailed(
        spec.index(), spec.startTime(), Stage.CANCELLED.name(), message);
    return ChunkResult.failed(
        spec.chunkName(),
        new ChunkError(spec.index(), spec.startTime(), Stage.CANCELLED, message));
  }
}
