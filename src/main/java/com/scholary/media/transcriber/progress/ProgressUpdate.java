package com.scholary.media.transcriber.progress;

/**
 * A partial change to a session's progress. Unset fields keep their current value.
 *
 * <p>Terminal stages cannot be set here; use {@link ProgressTracker#completeSession}.
 */
public final class ProgressUpdate {

  private final Double progress;
  private final String currentTask;
  private final ProcessingStage stage;
  private final Integer chunksTotal;
  private final Integer chunksCompleted;
  private final Integer currentChunk;
  private final Double mediaDuration;

  private ProgressUpdate(Builder builder) {
    this.progress = builder.progress;
    this.currentTask = builder.currentTask;
    this.stage = builder.stage;
    this.chunksTotal = builder.chunksTotal;
    this.chunksCompleted = builder.chunksCompleted;
    this.currentChunk = builder.currentChunk;
    this.mediaDuration = builder.mediaDuration;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Shorthand for the common stage + progress + label update. */
  public static ProgressUpdate of(ProcessingStage stage, double progress, String currentTask) {
    return builder().stage(stage).progress(progress).currentTask(currentTask).build();
  }

  /** Label-only update. */
  public static ProgressUpdate task(String currentTask) {
    return builder().currentTask(currentTask).build();
  }

  SessionProgress applyTo(SessionProgress current) {
    return new SessionProgress(
        current.sessionId(),
        current.status() == SessionStatus.STARTING ? SessionStatus.PROCESSING : current.status(),
        stage != null ? stage : current.stage(),
        progress != null ? clamp(progress) : current.progress(),
        currentTask != null ? currentTask : current.currentTask(),
        chunksTotal != null ? chunksTotal : current.chunksTotal(),
        chunksCompleted != null ? chunksCompleted : current.chunksCompleted(),
        currentChunk != null ? currentChunk : current.currentChunk(),
        current.startTime(),
        current.estimatedTimeRemaining(),
        mediaDuration != null ? mediaDuration : current.mediaDuration(),
        current.message());
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(100.0, value));
  }

  public static final class Builder {
    private Double progress;
    private String currentTask;
    private ProcessingStage stage;
    private Integer chunksTotal;
    private Integer chunksCompleted;
    private Integer currentChunk;
    private Double mediaDuration;

    private Builder() {}

    public Builder progress(double progress) {
      this.progress = progress;
      return this;
    }

    public Builder currentTask(String currentTask) {
      this.currentTask = currentTask;
      return this;
    }

    public Builder stage(ProcessingStage stage) {
      if (stage != null && stage.isTerminal()) {
        throw new IllegalArgumentException(
            "Terminal stage " + stage + " can only be set by completing the session");
      }
      this.stage = stage;
      return this;
    }

    public Builder chunksTotal(int chunksTotal) {
      this.chunksTotal = chunksTotal;
      return this;
    }

    public Builder chunksCompleted(int chunksCompleted) {
      this.chunksCompleted = chunksCompleted;
      return this;
    }

    public Builder currentChunk(int currentChunk) {
      this.currentChunk = currentChunk;
      return this;
    }

    public Builder mediaDuration(double mediaDuration) {
      this.mediaDuration = mediaDuration;
      return this;
    }

    public ProgressUpdate build() {
      return new ProgressUpdate(this);
    }
  }
}
