package com.scholary.media.transcriber.files;

import java.util.Map;

/** Summary of the files currently tracked. */
public record FileStats(int count, long totalBytes, Map<FileKind, Integer> countsByKind) {

  public FileStats {
    countsByKind = Map.copyOf(countsByKind);
  }
}
