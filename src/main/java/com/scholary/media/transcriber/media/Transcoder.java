package com.scholary.media.transcriber.media;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Writes a time slice of a media file to a new file.
 *
 * <p>Used both to split the source into chunk files and to pull a mono audio track out of each
 * chunk before transcription.
 */
public interface Transcoder {

  /**
   * Extract {@code [startSeconds, startSeconds + durationSeconds)} of {@code input} into {@code
   * output}.
   *
   * @param input source media
   * @param startSeconds offset into the source
   * @param durationSeconds length to extract, or null for everything after the offset
   * @param output destination file, overwritten if present
   * @param options codec settings for the output
   * @param timeout maximum time the transcoder may run
   * @throws TranscodeException if the output could not be written in time
   */
  void extract(
      Path input,
      double startSeconds,
      Double durationSeconds,
      Path output,
      EncodingOptions options,
      Duration timeout)
      throws TranscodeException;
}
