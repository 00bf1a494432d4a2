package com.scholary.media.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Represents a single segment of transcribed audio.
 *
 * <p>This matches the structure returned by the Whisper service. Times are relative to the start of
 * the audio file that was sent, not to the original media.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {}
