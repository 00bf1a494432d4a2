package com.scholary.media.transcriber;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.media.transcriber.memory.WorkerPoolSizer;
import com.scholary.media.transcriber.service.TranscriptionPipeline;
import com.scholary.media.transcriber.whisper.SpeechModelFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "transcription.temp-dir=${java.io.tmpdir}/media-transcriber-test")
class MediaTranscriberApplicationTest {

  @Autowired private TranscriptionPipeline pipeline;
  @Autowired private WorkerPoolSizer sizer;
  @Autowired private SpeechModelFactory modelFactory;

  @Test
  void contextLoads() {
    assertThat(pipeline).isNotNull();
    assertThat(sizer.optimalWorkers()).isGreaterThanOrEqualTo(1);
    assertThat(modelFactory.create()).isNotSameAs(modelFactory.create());
  }
}
