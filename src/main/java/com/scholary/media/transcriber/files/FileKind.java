package com.scholary.media.transcriber.files;

/** Category of a tracked temporary file. */
public enum FileKind {
  VIDEO_CHUNK,
  AUDIO,
  OTHER
}
