package com.scholary.media.transcriber.whisper;

import java.nio.file.Path;

/**
 * A loaded speech-to-text model.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the worker pool.
 * Instances are owned by exactly one transcription worker and are never shared between threads.
 */
public interface SpeechModel {

  /**
   * Transcribe an audio file.
   *
   * @param audioFile mono audio file to transcribe
   * @param options request options
   * @return the transcription response, segment times relative to the file start
   * @throws WhisperException if transcription fails
   */
  WhisperResponse transcribe(Path audioFile, TranscribeOptions options);
}
