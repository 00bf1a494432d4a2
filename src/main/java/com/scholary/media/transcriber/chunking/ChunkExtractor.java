package com.scholary.media.transcriber.chunking;

import com.scholary.media.transcriber.concurrent.BoundedExecutors;
import com.scholary.media.transcriber.concurrent.CancellationSignal;
import com.scholary.media.transcriber.config.TranscriptionProperties;
import com.scholary.media.transcriber.files.FileKind;
import com.scholary.media.transcriber.files.FileLifecycleManager;
import com.scholary.media.transcriber.logging.StructuredLogger;
import com.scholary.media.transcriber.media.EncodingOptions;
import com.scholary.media.transcriber.media.FfmpegProperties;
import com.scholary.media.transcriber.media.TranscodeException;
import com.scholary.media.transcriber.media.Transcoder;
import com.scholary.media.transcriber.transcription.ChunkError;
import com.scholary.media.transcriber.transcription.ChunkError.Stage;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Writes each planned chunk of the source to its own file.
 *
 * <p>Extraction is I/O bound, so it runs on its own pool which may be wider than the transcription
 * pool. A chunk whose extraction fails is dropped and reported; it is not retried. {@link
 * #extract} returns only once every chunk has either been written or dropped.
 */
@Component
public class ChunkExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkExtractor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final Transcoder transcoder;
  private final EncodingOptions chunkOptions;
  private final Duration extractTimeout;
  private final int poolCap;

  public ChunkExtractor(
      Transcoder transcoder,
      FfmpegProperties ffmpegProperties,
      TranscriptionProperties transcriptionProperties) {
    this.transcoder = transcoder;
    this.chunkOptions =
        EncodingOptions.mediaChunk(
            ffmpegProperties.chunkVideoCodec(), ffmpegProperties.chunkAudioCodec());
    this.extractTimeout = Duration.ofSeconds(ffmpegProperties.chunkExtractTimeoutSeconds());
    this.poolCap = transcriptionProperties.extraction().poolCap();
  }

  /**
   * Extract every planned chunk.
   *
   * <p>Written chunk files are registered with {@code files} as retained; the transcription stage
   * releases them. Once {@code cancellation} is raised, chunks not yet started are reported as
   * {@link Stage#CANCELLED}.
   *
   * @param input source media
   * @param plan chunk plan
   * @param files the session's file registry
   * @param cancellation the session's cancellation signal
   * @return extracted chunks and dropped ones
   * @throws CancellationException if the calling thread is interrupted while waiting
   */
  public ExtractionReport extract(
      Path input,
      List<ChunkSpec> plan,
      FileLifecycleManager files,
      CancellationSignal cancellation) {

    if (plan.isEmpty()) {
      return new ExtractionReport(List.of(), List.of());
    }

    int poolSize = Math.min(poolCap, plan.size());
    LOGGER.info("Extracting {} chunks with {} threads", plan.size(), poolSize);

    List<ChunkSpec> extracted = new ArrayList<>();
    List<ChunkError> failures = new ArrayList<>();

    ThreadPoolTaskExecutor executor = BoundedExecutors.fixed("extract-", poolSize);
    try {
      List<Future<ChunkError>> futures = new ArrayList<>(plan.size());
      for (ChunkSpec spec : plan) {
        futures.add(executor.submit(() -> extractOne(input, spec, files, cancellation)));
      }

      for (int i = 0; i < plan.size(); i++) {
        ChunkSpec spec = plan.get(i);
        ChunkError error;
        try {
          error = futures.get(i).get();
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          error =
              new ChunkError(spec.index(), spec.startTime(), Stage.EXTRACTION, cause.toString());
          structuredLogger.logChunkFailed(
              spec.index(), spec.startTime(), Stage.EXTRACTION.name(), cause.toString());
        }
        if (error == null) {
          extracted.add(spec);
        } else {
          failures.add(error);
        }
      }
    } catch (InterruptedException e) {
      cancellation.raise("Interrupted");
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for chunk extraction");
    } finally {
      executor.shutdown();
    }

    extracted.sort(Comparator.comparingInt(ChunkSpec::index));
    if (!failures.isEmpty()) {
      LOGGER.warn(
          "{} of {} chunks could not be extracted and will be missing from the transcript",
          failures.size(),
          plan.size());
    }
    return new ExtractionReport(extracted, failures);
  }

  /** Returns null on success. */
  private ChunkError extractOne(
      Path input, ChunkSpec spec, FileLifecycleManager files, CancellationSignal cancellation) {
    if (cancellation.isRaised()) {
      String message = "Cancelled before extraction";
      structuredLogger.logChunkFailed(
          spec.index(), spec.startTime(), Stage.CANCELLED.name(), message);
      return new ChunkError(spec.index(), spec.startTime(), Stage.CANCELLED, message);
    }

    long startNanos = System.nanoTime();
    try {
      transcoder.extract(
          input,
          spec.startTime(),
          spec.duration(),
          spec.outputPath(),
          chunkOptions,
          extractTimeout);
    } catch (TranscodeException e) {
      structuredLogger.logChunkFailed(
          spec.index(), spec.startTime(), Stage.EXTRACTION.name(), e.getMessage());
      files.discard(spec.outputPath());
      return new ChunkError(spec.index(), spec.startTime(), Stage.EXTRACTION, e.getMessage());
    }

    files.trackRetained(spec.outputPath(), FileKind.VIDEO_CHUNK);
    structuredLogger.logChunkExtracted(
        spec.index(),
        spec.startTime(),
        Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
    return null;
  }
}
