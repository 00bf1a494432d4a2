package com.scholary.media.transcriber.files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileLifecycleManagerTest {

  @TempDir Path tempDir;

  @Test
  void track_shouldEvictOldestFilesBeyondLimit() throws IOException {
    FileLifecycleManager manager = new FileLifecycleManager(2);
    Path first = file("a.wav", 10);
    Path second = file("b.wav", 10);
    Path third = file("c.wav", 10);

    manager.track(first, FileKind.AUDIO);
    manager.track(second, FileKind.AUDIO);
    manager.track(third, FileKind.AUDIO);

    assertThat(first).doesNotExist();
    assertThat(second).exists();
    assertThat(third).exists();
    assertThat(manager.trackedFiles()).extracting(TrackedFile::path).containsExactly(second, third);
  }

  @Test
  void trackRetained_shouldNotBeEvictedUntilReleased() throws IOException {
    FileLifecycleManager manager = new FileLifecycleManager(1);
    Path chunk = file("chunk.mp4", 100);
    Path audio = file("chunk.wav", 10);

    manager.trackRetained(chunk, FileKind.VIDEO_CHUNK);
    manager.track(audio, FileKind.AUDIO);

    assertThat(chunk).exists();
    assertThat(audio).exists();
    assertThat(manager.stats().count()).isEqualTo(2);

    manager.release(chunk);
    manager.track(file("other.wav", 10), FileKind.AUDIO);

    assertThat(chunk).doesNotExist();
  }

  @Test
  void discard_shouldDeleteAndUntrackFile() throws IOException {
    FileLifecycleManager manager = new FileLifecycleManager(5);
    Path audio = file("a.wav", 42);
    manager.track(audio, FileKind.AUDIO);

    long reclaimed = manager.discard(audio);

    assertThat(reclaimed).isEqualTo(42);
    assertThat(audio).doesNotExist();
    assertThat(manager.trackedFiles()).isEmpty();
  }

  @Test
  void discard_shouldTolerateMissingFile() {
    FileLifecycleManager manager = new FileLifecycleManager(5);

    assertThat(manager.discard(tempDir.resolve("never-written.wav"))).isZero();
  }

  @Test
  void cleanupAll_shouldDeleteEverythingAndReportBytes() throws IOException {
    FileLifecycleManager manager = new FileLifecycleManager(5);
    manager.trackRetained(file("a.mp4", 100), FileKind.VIDEO_CHUNK);
    manager.track(file("a.wav", 20), FileKind.AUDIO);
    manager.track(tempDir.resolve("missing.txt"), FileKind.OTHER);

    CleanupReport report = manager.cleanupAll();

    assertThat(report.filesRemoved()).isEqualTo(2);
    assertThat(report.bytesReclaimed()).isEqualTo(120);
    assertThat(manager.stats().count()).isZero();
    assertThat(manager.cleanupAll()).isEqualTo(CleanupReport.EMPTY);
  }

  @Test
  void cleanupByKind_shouldOnlyTouchThatKind() throws IOException {
    FileLifecycleManager manager = new FileLifecycleManager(5);
    Path chunk = file("a.mp4", 100);
    Path audio = file("a.wav", 20);
    manager.trackRetained(chunk, FileKind.VIDEO_CHUNK);
    manager.track(audio, FileKind.AUDIO);

    CleanupReport report = manager.cleanupByKind(FileKind.AUDIO);

    assertThat(report).isEqualTo(new CleanupReport(1, 20));
    assertThat(chunk).exists();
    assertThat(audio).doesNotExist();
  }

  @Test
  void stats_shouldSummarizeByKind() throws IOException {
    FileLifecycleManager manager = new FileLifecycleManager(5);
    manager.trackRetained(file("a.mp4", 100), FileKind.VIDEO_CHUNK);
    manager.trackRetained(file("b.mp4", 50), FileKind.VIDEO_CHUNK);
    manager.track(file("a.wav", 20), FileKind.AUDIO);

    FileStats stats = manager.stats();

    assertThat(stats.count()).isEqualTo(3);
    assertThat(stats.totalBytes()).isEqualTo(170);
    assertThat(stats.countsByKind())
        .containsEntry(FileKind.VIDEO_CHUNK, 2)
        .containsEntry(FileKind.AUDIO, 1)
        .doesNotContainKey(FileKind.OTHER);
  }

  @Test
  void constructor_shouldRejectNonPositiveLimit() {
    assertThatThrownBy(() -> new FileLifecycleManager(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private Path file(String name, int bytes) throws IOException {
    return Files.write(tempDir.resolve(name), new byte[bytes]);
  }
}
