package com.scholary.media.transcriber.transcription;

import com.scholary.media.transcriber.chunking.ChunkSpec;
import com.scholary.media.transcriber.config.TranscriptionProperties.AudioProperties;
import com.scholary.media.transcriber.files.FileKind;
import com.scholary.media.transcriber.files.FileLifecycleManager;
import com.scholary.media.transcriber.logging.StructuredLogger;
import com.scholary.media.transcriber.media.EncodingOptions;
import com.scholary.media.transcriber.media.TranscodeException;
import com.scholary.media.transcriber.media.Transcoder;
import com.scholary.media.transcriber.transcription.ChunkError.Stage;
import com.scholary.media.transcriber.whisper.SpeechModel;
import com.scholary.media.transcriber.whisper.SpeechModelFactory;
import com.scholary.media.transcriber.whisper.TranscribeOptions;
import com.scholary.media.transcriber.whisper.TranscriptSegment;
import com.scholary.media.transcriber.whisper.WhisperResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transcribes chunks one at a time on a single pool thread.
 *
 * <p>The worker creates its speech model on the first chunk it receives and keeps it for all later
 * chunks. If creation fails, that chunk fails and the next chunk tries again.
 *
 * <p>Per chunk: pull a mono audio track out of the chunk file, send it to the model, shift the
 * returned segments onto the source timeline. Every failure is turned into a {@link ChunkResult}
 * with a {@link ChunkError}; nothing is thrown to the caller. Not thread-safe; one instance per
 * pool thread.
 */
class TranscriptionWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionWorker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final int workerId;
  private final SpeechModelFactory modelFactory;
  private final Transcoder transcoder;
  private final EncodingOptions audioOptions;
  private final Duration chunkTimeout;
  private final FileLifecycleManager files;

  private SpeechModel model;

  TranscriptionWorker(
      int workerId,
      SpeechModelFactory modelFactory,
      Transcoder transcoder,
      AudioProperties audio,
      Duration chunkTimeout,
      FileLifecycleManager files) {
    this.workerId = workerId;
    this.modelFactory = modelFactory;
    this.transcoder = transcoder;
    this.audioOptions =
        EncodingOptions.speechAudio(audio.codec(), audio.channels(), audio.sampleRate());
    this.chunkTimeout = chunkTimeout;
    this.files = files;
  }

  ChunkResult process(ChunkSpec spec) {
    structuredLogger.logChunkStarted(workerId, spec.index(), spec.startTime(), spec.duration());
    long startNanos = System.nanoTime();
    long deadline = startNanos + chunkTimeout.toNanos();
    Path audioPath = audioPathFor(spec.outputPath());

    try {
      try {
        transcoder.extract(
            spec.outputPath(), 0, null, audioPath, audioOptions, remaining(deadline));
      } catch (TranscodeException e) {
        return fail(spec, e.isTimeout() ? Stage.TIMEOUT : Stage.AUDIO_EXTRACTION, e.getMessage());
      } catch (RuntimeException e) {
        return fail(spec, Stage.AUDIO_EXTRACTION, e.toString());
      }
      files.track(audioPath, FileKind.AUDIO);

      SpeechModel speechModel;
      try {
        speechModel = model();
      } catch (RuntimeException e) {
        return fail(spec, Stage.TRANSCRIPTION, "Speech model unavailable: " + e.getMessage());
      }

      if (System.nanoTime() >= deadline) {
        return fail(spec, Stage.TIMEOUT, timeoutMessage());
      }

      WhisperResponse response;
      try {
        response =
            speechModel.transcribe(
                audioPath,
                TranscribeOptions.withWordTimestamps(remaining(deadline), spec.index()));
      } catch (RuntimeException e) {
        Stage stage = System.nanoTime() >= deadline ? Stage.TIMEOUT : Stage.TRANSCRIPTION;
        return fail(spec, stage, e.getMessage());
      }

      List<Segment> segments = new ArrayList<>(response.segments().size());
      for (TranscriptSegment segment : response.segments()) {
        segments.add(
            Segment.of(
                segment.start() + spec.startTime(),
                segment.end() + spec.startTime(),
                segment.text()));
      }

      long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
      structuredLogger.logChunkFinished(spec.index(), spec.startTime(), segments.size(), elapsedMs);
      return ChunkResult.succeeded(
          spec.index(), spec.startTime(), spec.chunkName(), segments, response.fullText());
    } finally {
      files.discard(audioPath);
      files.release(spec.outputPath());
    }
  }

  private SpeechModel model() {
    if (model == null) {
      LOGGER.debug("Worker {} creating speech model", workerId);
      model = modelFactory.create();
    }
    return model;
  }

  ChunkResult fail(ChunkSpec spec, Stage stage, String message) {
    structuredLogger.logChunkFailed(spec.index(), spec.startTime(), stage.name(), message);
    return ChunkResult.failed(
        spec.chunkName(), new ChunkError(spec.index(), spec.startTime(), stage, message));
  }

  private String timeoutMessage() {
    return String.format("Chunk exceeded %ds timeout", chunkTimeout.toSeconds());
  }

  /** Time left before the deadline, never less than one millisecond. */
  private static Duration remaining(long deadline) {
    long nanos = deadline - System.nanoTime();
    return nanos > 1_000_000 ? Duration.ofNanos(nanos) : Duration.ofMillis(1);
  }

  static Path audioPathFor(Path chunkFile) {
    String name = chunkFile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return chunkFile.resolveSibling(base + ".wav");
  }
}
