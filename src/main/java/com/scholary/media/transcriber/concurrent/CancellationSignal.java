package com.scholary.media.transcriber.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-session cancellation flag.
 *
 * <p>Raising the signal stops new chunk work from being started; work already running is allowed
 * to finish. The signal cannot be lowered again.
 */
public class CancellationSignal {

  private final AtomicBoolean raised = new AtomicBoolean(false);
  private volatile String reason;

  /**
   * Raise the signal.
   *
   * @param reason human-readable reason, reported in the session's terminal message
   * @return true if this call raised it, false if it was already raised
   */
  public boolean raise(String reason) {
    if (raised.compareAndSet(false, true)) {
      this.reason = reason;
      return true;
    }
    return false;
  }

  public boolean isRaised() {
    return raised.get();
  }

  public String reason() {
    return reason;
  }
}
