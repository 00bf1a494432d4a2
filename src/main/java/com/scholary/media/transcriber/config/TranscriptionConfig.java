package com.scholary.media.transcriber.config;

import com.scholary.media.transcriber.analysis.AnalysisProperties;
import com.scholary.media.transcriber.memory.WorkerPoolProperties;
import com.scholary.media.transcriber.progress.ProgressProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcription-related beans.
 *
 * <p>Enables the pipeline's property records to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  TranscriptionProperties.class,
  WorkerPoolProperties.class,
  AnalysisProperties.class,
  ProgressProperties.class
})
public class TranscriptionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
