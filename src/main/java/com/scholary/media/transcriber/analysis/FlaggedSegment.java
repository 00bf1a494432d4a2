package com.scholary.media.transcriber.analysis;

/** A segment picked out by a question or emphasis pattern. */
public record FlaggedSegment(String timestamp, String text, double start) {}
