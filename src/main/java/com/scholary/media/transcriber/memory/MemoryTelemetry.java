package com.scholary.media.transcriber.memory;

/** Source of live memory readings. */
public interface MemoryTelemetry {

  /** Take a fresh reading. Implementations must not cache. */
  MemorySnapshot snapshot();
}
