package com.scholary.media.transcriber.files;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A temporary file registered with a {@link FileLifecycleManager}.
 *
 * @param retained true while the file is still needed and must not be evicted
 */
public record TrackedFile(
    Path path, FileKind kind, Instant createdAt, long size, boolean retained) {

  TrackedFile released() {
    return new TrackedFile(path, kind, createdAt, size, false);
  }
}
