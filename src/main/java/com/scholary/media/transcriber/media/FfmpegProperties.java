package com.scholary.media.transcriber.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>Binary locations, the codecs used when splitting the source into chunk files, and the probe
 * timeout.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @NotBlank String chunkVideoCodec,
    @NotBlank String chunkAudioCodec,
    @NotBlank String chunkExtension,
    @Positive int probeTimeoutSeconds,
    @Positive int chunkExtractTimeoutSeconds) {}
