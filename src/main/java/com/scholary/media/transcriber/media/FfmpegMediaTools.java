package com.scholary.media.transcriber.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link MediaProber} and {@link Transcoder} backed by the ffprobe and ffmpeg binaries.
 *
 * <p>Commands are built as argument lists (never a single shell string) so paths with spaces are
 * passed through untouched.
 */
@Component
public class FfmpegMediaTools implements MediaProber, Transcoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaTools.class);

  private final FfmpegProperties properties;
  private final ProcessRunner processRunner;

  @Autowired
  public FfmpegMediaTools(FfmpegProperties properties) {
    this(properties, new ProcessRunner());
  }

  FfmpegMediaTools(FfmpegProperties properties, ProcessRunner processRunner) {
    this.properties = properties;
    this.processRunner = processRunner;
  }

  /**
   * Get the media duration using ffprobe.
   *
   * <p>Reads {@code format=duration}, which covers both audio-only and video containers.
   */
  @Override
  public double probeDuration(Path mediaFile) throws ProbeException {
    if (!Files.isRegularFile(mediaFile)) {
      throw new ProbeException("Media file not found: " + mediaFile);
    }

    ProcessRunner.Result result;
    try {
      result =
          processRunner.run(
              buildProbeCommand(mediaFile), Duration.ofSeconds(properties.probeTimeoutSeconds()));
    } catch (IOException e) {
      throw new ProbeException("ffprobe could not be started for " + mediaFile.getFileName(), e);
    }

    if (result.timedOut()) {
      throw new ProbeException(
          String.format("ffprobe timed out after %ds", properties.probeTimeoutSeconds()));
    }
    if (result.exitCode() != 0) {
      LOGGER.error("ffprobe failed: file={}, output={}", mediaFile, result.output());
      throw new ProbeException(
          "ffprobe failed with exit code: " + result.exitCode() + ", output: " + result.output());
    }

    return parseDuration(result.output());
  }

  static double parseDuration(String output) throws ProbeException {
    String firstLine = output.lines().findFirst().orElse("").trim();
    try {
      double duration = Double.parseDouble(firstLine);
      if (Double.isNaN(duration) || Double.isInfinite(duration)) {
        throw new ProbeException("ffprobe reported no usable duration: " + firstLine);
      }
      return duration;
    } catch (NumberFormatException e) {
      throw new ProbeException("Failed to parse duration from ffprobe output: " + firstLine, e);
    }
  }

  @Override
  public void extract(
      Path input,
      double startSeconds,
      Double durationSeconds,
      Path output,
      EncodingOptions options,
      Duration timeout)
      throws TranscodeException {

    List<String> command =
        buildExtractCommand(input, startSeconds, durationSeconds, output, options);

    ProcessRunner.Result result;
    try {
      result = processRunner.run(command, timeout);
    } catch (IOException e) {
      throw new TranscodeException("ffmpeg could not be run for " + output.getFileName(), e);
    }

    if (result.timedOut()) {
      throw TranscodeException.timedOut(
          String.format(
              "ffmpeg timed out after %ds writing %s", timeout.toSeconds(), output.getFileName()));
    }
    if (result.exitCode() != 0) {
      throw new TranscodeException(
          String.format(
              "ffmpeg exited with code %d writing %s: %s",
              result.exitCode(), output.getFileName(), result.output()));
    }
  }

  List<String> buildProbeCommand(Path mediaFile) {
    return List.of(
        properties.ffprobePath(),
        "-v",
        "error",
        "-show_entries",
        "format=duration",
        "-of",
        "default=noprint_wrappers=1:nokey=1",
        mediaFile.toString());
  }

  /**
   * Build the ffmpeg command for one extraction.
   *
   * <p>-ss before -i: input seeking, fast and accurate when re-encoding. -t: duration to keep.
   * -y: overwrite the output file. -loglevel error keeps captured output short.
   */
  List<String> buildExtractCommand(
      Path input,
      double startSeconds,
      Double durationSeconds,
      Path output,
      EncodingOptions options) {
    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-hide_banner");
    command.add("-loglevel");
    command.add("error");
    if (startSeconds > 0) {
      command.add("-ss");
      command.add(formatSeconds(startSeconds));
    }
    command.add("-i");
    command.add(input.toString());
    if (durationSeconds != null) {
      command.add("-t");
      command.add(formatSeconds(durationSeconds));
    }
    command.addAll(options.toFfmpegArguments());
    command.add("-y");
    command.add(output.toString());
    return command;
  }

  private static String formatSeconds(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }
}
