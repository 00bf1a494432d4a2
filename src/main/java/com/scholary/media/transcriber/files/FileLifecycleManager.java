package com.scholary.media.transcriber.files;

import com.scholary.media.transcriber.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded registry of a session's temporary files.
 *
 * <p>Entries are kept in registration order. When a new entry pushes the registry past its limit,
 * the oldest released entries are deleted until it fits again. Retained entries (chunk files not
 * yet transcribed) are never evicted, so the registry may temporarily exceed its limit while many
 * chunks are waiting.
 *
 * <p>Thread-safe: extraction and transcription workers register and release files concurrently.
 * File deletion failures are logged and otherwise ignored.
 */
public class FileLifecycleManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileLifecycleManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final int maxTrackedFiles;
  private final Map<Path, TrackedFile> files = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  public FileLifecycleManager(int maxTrackedFiles) {
    if (maxTrackedFiles < 1) {
      throw new IllegalArgumentException("maxTrackedFiles must be positive: " + maxTrackedFiles);
    }
    this.maxTrackedFiles = maxTrackedFiles;
  }

  /** Register a file that may be evicted at any time. */
  public void track(Path path, FileKind kind) {
    register(path, kind, false);
  }

  /** Register a file that stays until {@link #release(Path)} is called for it. */
  public void trackRetained(Path path, FileKind kind) {
    register(path, kind, true);
  }

  /** Make a retained file evictable. Unknown paths are ignored. */
  public void release(Path path) {
    lock.lock();
    try {
      files.computeIfPresent(path, (p, file) -> file.released());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stop tracking a file and delete it.
   *
   * @return bytes reclaimed, 0 if the file was already gone
   */
  public long discard(Path path) {
    lock.lock();
    try {
      files.remove(path);
    } finally {
      lock.unlock();
    }
    return delete(path);
  }

  /** Delete every tracked file. */
  public CleanupReport cleanupAll() {
    List<Path> toDelete;
    lock.lock();
    try {
      toDelete = new ArrayList<>(files.keySet());
      files.clear();
    } finally {
      lock.unlock();
    }
    CleanupReport report = deleteAll(toDelete);
    structuredLogger.logCleanup("Session cleanup", report.filesRemoved(), report.bytesReclaimed());
    return report;
  }

  /** Delete every tracked file of one kind, retained or not. */
  public CleanupReport cleanupByKind(FileKind kind) {
    List<Path> toDelete = new ArrayList<>();
    lock.lock();
    try {
      Iterator<TrackedFile> it = files.values().iterator();
      while (it.hasNext()) {
        TrackedFile file = it.next();
        if (file.kind() == kind) {
          toDelete.add(file.path());
          it.remove();
        }
      }
    } finally {
      lock.unlock();
    }
    CleanupReport report = deleteAll(toDelete);
    structuredLogger.logCleanup(
        "Cleanup of " + kind, report.filesRemoved(), report.bytesReclaimed());
    return report;
  }

  public FileStats stats() {
    lock.lock();
    try {
      Map<FileKind, Integer> counts = new EnumMap<>(FileKind.class);
      long totalBytes = 0;
      for (TrackedFile file : files.values()) {
        counts.merge(file.kind(), 1, Integer::sum);
        totalBytes += file.size();
      }
      return new FileStats(files.size(), totalBytes, counts);
    } finally {
      lock.unlock();
    }
  }

  /** Snapshot of tracked entries, oldest first. */
  public List<TrackedFile> trackedFiles() {
    lock.lock();
    try {
      return List.copyOf(files.values());
    } finally {
      lock.unlock();
    }
  }

  private void register(Path path, FileKind kind, boolean retained) {
    TrackedFile entry = new TrackedFile(path, kind, Instant.now(), sizeOf(path), retained);
    List<Path> evicted = new ArrayList<>();

    lock.lock();
    try {
      files.remove(path);
      files.put(path, entry);

      Iterator<TrackedFile> it = files.values().iterator();
      while (files.size() > maxTrackedFiles && it.hasNext()) {
        TrackedFile candidate = it.next();
        if (!candidate.retained() && !candidate.path().equals(path)) {
          evicted.add(candidate.path());
          it.remove();
        }
      }
    } finally {
      lock.unlock();
    }

    if (!evicted.isEmpty()) {
      CleanupReport report = deleteAll(evicted);
      structuredLogger.logCleanup(
          "File limit reached", report.filesRemoved(), report.bytesReclaimed());
    }
  }

  private CleanupReport deleteAll(List<Path> paths) {
    int removed = 0;
    long bytes = 0;
    for (Path path : paths) {
      long size = sizeOf(path);
      if (deleteQuietly(path)) {
        removed++;
        bytes += size;
      }
    }
    return new CleanupReport(removed, bytes);
  }

  private long delete(Path path) {
    long size = sizeOf(path);
    return deleteQuietly(path) ? size : 0;
  }

  private static boolean deleteQuietly(Path path) {
    try {
      return Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
      return false;
    }
  }

  private static long sizeOf(Path path) {
    try {
      return Files.exists(path) ? Files.size(path) : 0;
    } catch (IOException e) {
      LOGGER.debug("Could not read size of {}: {}", path, e.getMessage());
      return 0;
    }
  }
}
