package com.scholary.media.transcriber.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.scholary.media.transcriber.TestFixtures;
import com.scholary.media.transcriber.concurrent.CancellationSignal;
import com.scholary.media.transcriber.files.FileKind;
import com.scholary.media.transcriber.files.FileLifecycleManager;
import com.scholary.media.transcriber.files.TrackedFile;
import com.scholary.media.transcriber.media.EncodingOptions;
import com.scholary.media.transcriber.media.TranscodeException;
import com.scholary.media.transcriber.media.Transcoder;
import com.scholary.media.transcriber.transcription.ChunkError;
import com.scholary.media.transcriber.transcription.ChunkError.Stage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChunkExtractorTest {

  @Mock private Transcoder transcoder;

  @TempDir Path tempDir;

  private ChunkExtractor extractor;
  private FileLifecycleManager files;
  private Path input;
  private List<ChunkSpec> plan;

  @BeforeEach
  void setUp() throws Exception {
    extractor =
        new ChunkExtractor(
            transcoder, TestFixtures.ffmpeg(), TestFixtures.transcription(tempDir));
    files = new FileLifecycleManager(20);
    input = Files.write(tempDir.resolve("lecture.mp4"), new byte[8]);
    plan =
        new ChunkPlanner(TestFixtures.transcription(tempDir))
            .plan(650.0, null, tempDir, "lecture", "mp4");

    doAnswer(
            inv -> {
              Path output = inv.getArgument(3);
              Files.write(output, new byte[100]);
              return null;
            })
        .when(transcoder)
        .extract(any(), anyDouble(), any(), any(), any(), any());
  }

  @Test
  void extract_shouldWriteEveryChunkAndRetainIt() throws Exception {
    ExtractionReport report = extractor.extract(input, plan, files, new CancellationSignal());

    assertThat(report.extracted()).containsExactlyElementsOf(plan);
    assertThat(report.failures()).isEmpty();
    assertThat(files.trackedFiles())
        .hasSize(3)
        .allMatch(TrackedFile::retained)
        .allMatch(file -> file.kind() == FileKind.VIDEO_CHUNK);

    verify(transcoder)
        .extract(
            eq(input),
            eq(600.0),
            eq(plan.get(2).duration()),
            eq(plan.get(2).outputPath()),
            eq(EncodingOptions.mediaChunk("libx264", "aac")),
            eq(Duration.ofSeconds(300)));
  }

  @Test
  void extract_shouldDropFailedChunkAndKeepOthers() throws Exception {
    doThrow(new TranscodeException("ffmpeg exited with code 1"))
        .when(transcoder)
        .extract(any(), eq(300.0), any(), any(), any(), any());

    ExtractionReport report = extractor.extract(input, plan, files, new CancellationSignal());

    assertThat(report.extracted()).extracting(ChunkSpec::index).containsExactly(0, 2);
    assertThat(report.failures())
        .singleElement()
        .satisfies(
            error -> {
              assertThat(error.chunkIndex()).isEqualTo(1);
              assertThat(error.stage()).isEqualTo(Stage.EXTRACTION);
            });
    assertThat(files.trackedFiles()).hasSize(2);
  }

  @Test
  void extract_shouldReportNothingExtractedWhenAllFail() throws Exception {
    doThrow(new TranscodeException("no such codec"))
        .when(transcoder)
        .extract(any(), anyDouble(), any(), any(), any(), any());

    ExtractionReport report = extractor.extract(input, plan, files, new CancellationSignal());

    assertThat(report.nothingExtracted()).isTrue();
    assertThat(report.failures()).extracting(ChunkError::chunkIndex).containsExactly(0, 1, 2);
  }

  @Test
  void extract_shouldSkipChunksOnceCancelled() throws Exception {
    CancellationSignal cancellation = new CancellationSignal();
    cancellation.raise("stop");

    ExtractionReport report = extractor.extract(input, plan, files, cancellation);

    assertThat(report.extracted()).isEmpty();
    assertThat(report.failures()).extracting(ChunkError::stage).containsOnly(Stage.CANCELLED);
    verify(transcoder, never()).extract(any(), anyDouble(), any(), any(), any(), any());
  }
}
