package com.scholary.media.transcriber.whisper;

/**
 * Creates {@link SpeechModel} instances.
 *
 * <p>Each transcription worker calls this once, on its first chunk, and keeps the model for every
 * chunk it is assigned afterwards.
 */
@FunctionalInterface
public interface SpeechModelFactory {

  SpeechModel create();
}
