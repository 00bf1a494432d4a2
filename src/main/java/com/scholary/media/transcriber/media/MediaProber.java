package com.scholary.media.transcriber.media;

import java.nio.file.Path;

/** Reads the total duration of a media file. */
public interface MediaProber {

  /**
   * Probe a media file for its duration.
   *
   * @param mediaFile the file to probe
   * @return duration in seconds
   * @throws ProbeException if the duration is missing or the probe fails
   */
  double probeDuration(Path mediaFile) throws ProbeException;
}
