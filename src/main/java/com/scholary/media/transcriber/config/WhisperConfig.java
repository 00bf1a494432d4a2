package com.scholary.media.transcriber.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.media.transcriber.whisper.SpeechModelFactory;
import com.scholary.media.transcriber.whisper.WhisperClient;
import com.scholary.media.transcriber.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Whisper client.
 *
 * <p>Workers do not share a client: the factory bean hands each worker its own instance.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {

  @Bean
  public SpeechModelFactory speechModelFactory(
      WhisperProperties properties, ObjectMapper objectMapper) {
    return () -> new WhisperClient(properties, objectMapper);
  }
}
