package com.scholary.media.transcriber.media;

import java.util.ArrayList;
import java.util.List;

/**
 * Codec settings for a transcoder output.
 *
 * @param videoCodec video codec, ignored when {@code audioOnly}
 * @param audioCodec audio codec
 * @param audioChannels channel count, or null to keep the source's
 * @param sampleRate sample rate in Hz, or null to keep the source's
 * @param audioOnly drop the video stream
 */
public record EncodingOptions(
    String videoCodec,
    String audioCodec,
    Integer audioChannels,
    Integer sampleRate,
    boolean audioOnly) {

  /** Settings for an independent chunk of the source media. */
  public static EncodingOptions mediaChunk(String videoCodec, String audioCodec) {
    return new EncodingOptions(videoCodec, audioCodec, null, null, false);
  }

  /** Settings for the mono, fixed-rate audio the speech model expects. */
  public static EncodingOptions speechAudio(String audioCodec, int channels, int sampleRate) {
    return new EncodingOptions(null, audioCodec, channels, sampleRate, true);
  }

  /** ffmpeg output arguments for these settings. */
  public List<String> toFfmpegArguments() {
    List<String> args = new ArrayList<>();
    if (audioOnly) {
      args.add("-vn");
    } else if (videoCodec != null) {
      args.add("-c:v");
      args.add(videoCodec);
    }
    if (audioCodec != null) {
      args.add("-c:a");
      args.add(audioCodec);
    }
    if (audioChannels != null) {
      args.add("-ac");
      args.add(String.valueOf(audioChannels));
    }
    if (sampleRate != null) {
      args.add("-ar");
      args.add(String.valueOf(sampleRate));
    }
    return args;
  }
}
