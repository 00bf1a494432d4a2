package com.scholary.media.transcriber.media;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external command with a deadline.
 *
 * <p>stdout and stderr are merged and drained on a daemon gobbler thread so a chatty process can
 * never block on a full pipe while we wait for it. A process still running at the deadline is
 * destroyed forcibly.
 */
class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

  private static final long GOBBLER_FLUSH_MS = 500;
  private static final long FORCEFUL_SHUTDOWN_MS = 1000;
  private static final int MAX_CAPTURED_BYTES = 64 * 1024;

  /** Outcome of a finished process. */
  record Result(int exitCode, boolean timedOut, String output) {}

  Result run(List<String> command, Duration timeout) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    Process process = pb.start();

    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    Thread gobbler = new Thread(() -> drain(process.getInputStream(), captured), "process-gobbler");
    gobbler.setDaemon(true);
    gobbler.start();

    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(FORCEFUL_SHUTDOWN_MS, TimeUnit.MILLISECONDS);
        gobbler.join(GOBBLER_FLUSH_MS);
        return new Result(-1, true, capturedText(captured));
      }
      gobbler.join(GOBBLER_FLUSH_MS);
      return new Result(process.exitValue(), false, capturedText(captured));
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted =
          new InterruptedIOException("Interrupted while running " + command.get(0));
      interrupted.initCause(e);
      throw interrupted;
    }
  }

  private static void drain(InputStream in, ByteArrayOutputStream sink) {
    byte[] buffer = new byte[8192];
    try (in) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        synchronized (sink) {
          if (sink.size() < MAX_CAPTURED_BYTES) {
            sink.write(buffer, 0, Math.min(read, MAX_CAPTURED_BYTES - sink.size()));
          }
        }
      }
    } catch (IOException e) {
      LOGGER.debug("Process output stream closed: {}", e.getMessage());
    }
  }

  private static String capturedText(ByteArrayOutputStream captured) {
    synchronized (captured) {
      return captured.toString(StandardCharsets.UTF_8).trim();
    }
  }
}
