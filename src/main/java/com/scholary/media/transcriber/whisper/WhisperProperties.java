package com.scholary.media.transcriber.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper API client.
 *
 * <p>These control how each worker's client connects to the Whisper service, which model it asks
 * for, and how it handles timeouts and retries.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @NotBlank String model,
    String language,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
