package com.scholary.media.transcriber.transcription;

/** Callback invoked on the worker thread each time a chunk finishes, successfully or not. */
@FunctionalInterface
public interface ChunkCompletionListener {

  ChunkCompletionListener NONE = (result, completed, total) -> {};

  /**
   * @param result the finished chunk
   * @param completed chunks finished so far, including this one
   * @param total chunks handed to the pool
   */
  void onChunkCompleted(ChunkResult result, int completed, int total);
}
