package com.scholary.media.transcriber.service;

import com.scholary.media.transcriber.analysis.AnalysisProperties;
import com.scholary.media.transcriber.analysis.AnalysisResult;
import com.scholary.media.transcriber.analysis.ContentAnalyzer;
import com.scholary.media.transcriber.chunking.ChunkExtractor;
import com.scholary.media.transcriber.chunking.ChunkPlanner;
import com.scholary.media.transcriber.chunking.ChunkSpec;
import com.scholary.media.transcriber.chunking.ExtractionReport;
import com.scholary.media.transcriber.concurrent.CancellationSignal;
import com.scholary.media.transcriber.config.TranscriptionProperties;
import com.scholary.media.transcriber.files.CleanupReport;
import com.scholary.media.transcriber.files.FileLifecycleManager;
import com.scholary.media.transcriber.logging.StructuredLogger;
import com.scholary.media.transcriber.media.FfmpegProperties;
import com.scholary.media.transcriber.media.MediaProber;
import com.scholary.media.transcriber.memory.WorkerPoolSizer;
import com.scholary.media.transcriber.progress.ProcessingStage;
import com.scholary.media.transcriber.progress.ProgressTracker;
import com.scholary.media.transcriber.progress.ProgressUpdate;
import com.scholary.media.transcriber.transcript.MergedTranscript;
import com.scholary.media.transcriber.transcript.ResultAggregator;
import com.scholary.media.transcriber.transcription.ChunkCompletionListener;
import com.scholary.media.transcriber.transcription.ChunkError;
import com.scholary.media.transcriber.transcription.ChunkResult;
import com.scholary.media.transcriber.transcription.TranscriptionWorkerPool;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a transcription session end to end.
 *
 * <p>Phases:
 *
 * <ol>
 *   <li>Probe the media duration and plan chunks
 *   <li>Extract chunk files in parallel (barrier)
 *   <li>Size the worker pool from live memory and transcribe the chunks
 *   <li>Merge results in time order and analyze the transcript
 *   <li>Delete temporary files and complete the session
 * </ol>
 *
 * <p>A chunk that fails is left out of the transcript and reported in the result. The session
 * itself fails when the duration is unknown, when no chunk survives extraction or transcription,
 * when it is cancelled, or when merging or analysis throws.
 */
@Service
public class TranscriptionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionPipeline.class);

  private static final DateTimeFormatter SESSION_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final MediaProber prober;
  private final ChunkPlanner planner;
  private final ChunkExtractor extractor;
  private final WorkerPoolSizer sizer;
  private final TranscriptionWorkerPool workerPool;
  private final ResultAggregator aggregator;
  private final ContentAnalyzer analyzer;
  private final ProgressTracker progressTracker;
  private final TranscriptionProperties properties;
  private final List<String> defaultKeywords;
  private final String chunkExtension;
  private final Clock clock;
  private final Path tempDir;

  private final Map<String, CancellationSignal> running = new ConcurrentHashMap<>();

  public TranscriptionPipeline(
      MediaProber prober,
      ChunkPlanner planner,
      ChunkExtractor extractor,
      WorkerPoolSizer sizer,
      TranscriptionWorkerPool workerPool,
      ResultAggregator aggregator,
      ContentAnalyzer analyzer,
      ProgressTracker progressTracker,
      TranscriptionProperties properties,
      AnalysisProperties analysisProperties,
      FfmpegProperties ffmpegProperties,
      Clock clock) {
    this.prober = prober;
    this.planner = planner;
    this.extractor = extractor;
    this.sizer = sizer;
    this.workerPool = workerPool;
    this.aggregator = aggregator;
    this.analyzer = analyzer;
    this.progressTracker = progressTracker;
    this.properties = properties;
    this.defaultKeywords = analysisProperties.keywords();
    this.chunkExtension = ffmpegProperties.chunkExtension();
    this.clock = clock;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /**
   * Transcribe a media file.
   *
   * @param request the transcription request
   * @return the result of the completed session
   * @throws TranscriptionFailedException if the session ends in error
   */
  public TranscriptionResult transcribe(TranscriptionRequest request) {
    String baseName = baseName(request.inputPath());
    String sessionId =
        newSessionId(request.sessionName() != null ? request.sessionName() : baseName);
    CancellationSignal cancellation = new CancellationSignal();
    running.put(sessionId, cancellation);
    StructuredLogger.setSessionContext(sessionId);

    FileLifecycleManager files = new FileLifecycleManager(properties.maxTrackedFiles());
    Path sessionDir = tempDir.resolve(sessionId);

    try {
      LOGGER.info("Starting transcription: input={}", request.inputPath());
      progressTracker.startSession(sessionId, 0, 0);
      Files.createDirectories(sessionDir);

      // Phase 1: duration and plan
      progressTracker.updateProgress(
          sessionId, ProgressUpdate.of(ProcessingStage.ANALYSIS, 5, "Analyzing media..."));
      double duration = prober.probeDuration(request.inputPath());
      List<ChunkSpec> plan =
          planner.plan(duration, request.chunkSeconds(), sessionDir, baseName, chunkExtension);
      progressTracker.updateProgress(
          sessionId,
          ProgressUpdate.builder()
              .stage(ProcessingStage.PREPARATION)
              .progress(10)
              .chunksTotal(plan.size())
              .mediaDuration(duration)
              .currentTask("Splitting media into " + plan.size() + " chunks...")
              .build());

      // Phase 2: extraction
      ExtractionReport extraction =
          extractor.extract(request.inputPath(), plan, files, cancellation);
      abortIfCancelled(cancellation);
      if (extraction.nothingExtracted()) {
        throw new IllegalStateException("No chunks could be extracted");
      }
      progressTracker.updateProgress(
          sessionId,
          ProgressUpdate.of(
              ProcessingStage.PREPARATION,
              15,
              "Extracted " + extraction.extracted().size() + " of " + plan.size() + " chunks"));

      // Phase 3: transcription
      int workers = sizer.optimalWorkers();
      if (sizer.isUnderMemoryPressure()) {
        LOGGER.warn("Starting transcription under memory pressure: {}", sizer.recommendations());
      }
      List<ChunkResult> results =
          workerPool.transcribeAll(
              extraction.extracted(),
              workers,
              files,
              cancellation,
              progressListener(sessionId, plan.size()));
      abortIfCancelled(cancellation);

      int succeeded = (int) results.stream().filter(ChunkResult::success).count();
      if (succeeded == 0) {
        throw new IllegalStateException("All chunks failed to transcribe");
      }

      // Phase 4: merge and analyze
      progressTracker.updateProgress(
          sessionId,
          ProgressUpdate.of(
              ProcessingStage.POST_PROCESSING, 90, "Combining transcription results..."));
      MergedTranscript merged = aggregator.aggregate(results, plan);

      progressTracker.updateProgress(
          sessionId, ProgressUpdate.of(ProcessingStage.ANALYSIS, 92, "Analyzing content..."));
      List<String> keywords = request.keywords() != null ? request.keywords() : defaultKeywords;
      AnalysisResult analysis =
          analyzer.analyze(merged.transcriptText(), merged.segments(), keywords);

      // Phase 5: cleanup
      progressTracker.updateProgress(
          sessionId,
          ProgressUpdate.of(ProcessingStage.FINALIZATION, 95, "Cleaning up temporary files..."));
      CleanupReport cleanup = cleanup(files, sessionDir);

      List<ChunkError> failedChunks = failedChunks(extraction, results);
      if (!failedChunks.isEmpty()) {
        LOGGER.warn(
            "Transcript is missing {} of {} chunks: {}",
            failedChunks.size(),
            plan.size(),
            merged.coverageGaps());
      }

      progressTracker.completeSession(sessionId, true, "Processing complete!");
      LOGGER.info(
          "Transcription completed: chunks={}/{}, segments={}, words={}",
          merged.chunksMerged(),
          plan.size(),
          merged.segments().size(),
          merged.totalWords());

      return new TranscriptionResult(
          sessionId,
          merged.transcriptText(),
          merged.segments(),
          analysis,
          plan.size(),
          merged.chunksMerged(),
          failedChunks,
          merged.coverageGaps(),
          Math.min(workers, extraction.extracted().size()),
          cleanup.bytesReclaimed());

    } catch (Exception e) {
      String message = "Processing failed: " + e.getMessage();
      LOGGER.error("Transcription failed: {}", message, e);
      progressTracker.completeSession(sessionId, false, message);
      cleanup(files, sessionDir);
      throw new TranscriptionFailedException(sessionId, message, e);
    } finally {
      running.remove(sessionId);
      StructuredLogger.clearSessionContext();
    }
  }

  /**
   * Ask a running session to stop. Chunks already being processed finish; the session then ends in
   * error.
   *
   * @return true if the session was running and had not been cancelled yet
   */
  public boolean cancel(String sessionId) {
    CancellationSignal signal = running.get(sessionId);
    if (signal == null) {
      LOGGER.warn("Cancel requested for unknown session: {}", sessionId);
      return false;
    }
    boolean raised = signal.raise("Cancelled by request");
    if (raised) {
      LOGGER.info("Cancellation requested for session {}", sessionId);
    }
    return raised;
  }

  /** Chunks counted as completed are the successful ones; a failure only updates the label. */
  private ChunkCompletionListener progressListener(String sessionId, int chunksTotal) {
    return (result, completed, total) -> {
      if (result.success()) {
        progressTracker.recordChunkCompleted(sessionId, chunksTotal, result.chunkName());
      } else {
        progressTracker.updateProgress(
            sessionId,
            ProgressUpdate.builder()
                .currentChunk(completed)
                .currentTask(
                    "Chunk "
                        + (result.chunkIndex() + 1)
                        + " failed ("
                        + result.error().stage()
                        + ")")
                .build());
      }
    };
  }

  private static List<ChunkError> failedChunks(
      ExtractionReport extraction, List<ChunkResult> results) {
    List<ChunkError> failed = new ArrayList<>(extraction.failures());
    for (ChunkResult result : results) {
      if (!result.success()) {
        failed.add(result.error());
      }
    }
    failed.sort(Comparator.comparingInt(ChunkError::chunkIndex));
    return failed;
  }

  private static void abortIfCancelled(CancellationSignal cancellation) {
    if (cancellation.isRaised()) {
      throw new IllegalStateException("Cancelled: " + cancellation.reason());
    }
  }

  private static CleanupReport cleanup(FileLifecycleManager files, Path sessionDir) {
    CleanupReport report = files.cleanupAll();
    try {
      Files.deleteIfExists(sessionDir);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove session directory: {}", sessionDir, e);
    }
    return report;
  }

  private String newSessionId(String name) {
    String timestamp = LocalDateTime.now(clock).format(SESSION_TIMESTAMP);
    String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return sanitize(name) + "_" + timestamp + "_" + suffix;
  }

  static String baseName(Path input) {
    String name = input.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return sanitize(dot > 0 ? name.substring(0, dot) : name);
  }

  static String sanitize(String name) {
    String cleaned = name.strip().replaceAll("[^A-Za-z0-9_-]", "_");
    return cleaned.isEmpty() ? "session" : cleaned;
  }
}
