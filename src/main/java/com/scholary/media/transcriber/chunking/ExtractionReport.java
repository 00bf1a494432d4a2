package com.scholary.media.transcriber.chunking;

import com.scholary.media.transcriber.transcription.ChunkError;
import java.util.List;

/**
 * Outcome of the extraction stage.
 *
 * @param extracted chunks whose files were written, in plan order
 * @param failures chunks that were dropped, in plan order
 */
public record ExtractionReport(List<ChunkSpec> extracted, List<ChunkError> failures) {

  public ExtractionReport {
    extracted = List.copyOf(extracted);
    failures = List.copyOf(failures);
  }

  public boolean nothingExtracted() {
    return extracted.isEmpty();
  }
}
