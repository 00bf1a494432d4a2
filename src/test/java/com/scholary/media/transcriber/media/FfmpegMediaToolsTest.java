package com.scholary.media.transcriber.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.media.transcriber.TestFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegMediaToolsTest {

  @TempDir Path tempDir;

  private ProcessRunner runner;
  private FfmpegMediaTools tools;

  @BeforeEach
  void setUp() {
    runner = mock(ProcessRunner.class);
    tools = new FfmpegMediaTools(TestFixtures.ffmpeg(), runner);
  }

  @Test
  void buildExtractCommand_shouldSeekBeforeInputAndLimitDuration() {
    List<String> command =
        tools.buildExtractCommand(
            Paths.get("/media/in put.mp4"),
            300.0,
            50.25,
            Paths.get("/tmp/out.mp4"),
            EncodingOptions.mediaChunk("libx264", "aac"));

    assertThat(command)
        .containsExactly(
            "ffmpeg", "-hide_banner", "-loglevel", "error",
            "-ss", "300.000",
            "-i", "/media/in put.mp4",
            "-t", "50.250",
            "-c:v", "libx264", "-c:a", "aac",
            "-y", "/tmp/out.mp4");
  }

  @Test
  void buildExtractCommand_shouldProduceMonoSpeechAudio() {
    List<String> command =
        tools.buildExtractCommand(
            Paths.get("/tmp/chunk.mp4"),
            0,
            null,
            Paths.get("/tmp/chunk.wav"),
            EncodingOptions.speechAudio("pcm_s16le", 1, 16000));

    assertThat(command)
        .containsExactly(
            "ffmpeg", "-hide_banner", "-loglevel", "error",
            "-i", "/tmp/chunk.mp4",
            "-vn", "-c:a", "pcm_s16le", "-ac", "1", "-ar", "16000",
            "-y", "/tmp/chunk.wav");
  }

  @Test
  void probeDuration_shouldParseFfprobeOutput() throws IOException {
    Path media = Files.write(tempDir.resolve("a.mp4"), new byte[4]);
    when(runner.run(anyList(), any(Duration.class)))
        .thenReturn(new ProcessRunner.Result(0, false, "650.123000\n"));

    assertThat(tools.probeDuration(media)).isEqualTo(650.123);
  }

  @Test
  void probeDuration_shouldFailOnMissingFile() {
    assertThatThrownBy(() -> tools.probeDuration(tempDir.resolve("missing.mp4")))
        .isInstanceOf(ProbeException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void probeDuration_shouldFailOnNonZeroExit() throws IOException {
    Path media = Files.write(tempDir.resolve("a.mp4"), new byte[4]);
    when(runner.run(anyList(), any(Duration.class)))
        .thenReturn(new ProcessRunner.Result(1, false, "Invalid data found"));

    assertThatThrownBy(() -> tools.probeDuration(media))
        .isInstanceOf(ProbeException.class)
        .hasMessageContaining("exit code: 1");
  }

  @Test
  void parseDuration_shouldRejectUnusableValues() {
    assertThatThrownBy(() -> FfmpegMediaTools.parseDuration("N/A"))
        .isInstanceOf(ProbeException.class);
    assertThatThrownBy(() -> FfmpegMediaTools.parseDuration(""))
        .isInstanceOf(ProbeException.class);
    assertThatThrownBy(() -> FfmpegMediaTools.parseDuration("NaN"))
        .isInstanceOf(ProbeException.class);
  }

  @Test
  void extract_shouldReportTimeout() throws IOException {
    when(runner.run(anyList(), any(Duration.class)))
        .thenReturn(new ProcessRunner.Result(-1, true, ""));

    assertThatThrownBy(
            () ->
                tools.extract(
                    tempDir.resolve("in.mp4"),
                    0,
                    10.0,
                    tempDir.resolve("out.mp4"),
                    EncodingOptions.mediaChunk("libx264", "aac"),
                    Duration.ofSeconds(5)))
        .isInstanceOf(TranscodeException.class)
        .matches(e -> ((TranscodeException) e).isTimeout());
  }

  @Test
  void extract_shouldReportFailureOutput() throws IOException {
    when(runner.run(anyList(), any(Duration.class)))
        .thenReturn(new ProcessRunner.Result(1, false, "Unknown encoder 'libx264'"));

    assertThatThrownBy(
            () ->
                tools.extract(
                    tempDir.resolve("in.mp4"),
                    0,
                    10.0,
                    tempDir.resolve("out.mp4"),
                    EncodingOptions.mediaChunk("libx264", "aac"),
                    Duration.ofSeconds(5)))
        .isInstanceOf(TranscodeException.class)
        .hasMessageContaining("Unknown encoder");
  }
}
