package com.scholary.media.transcriber.progress;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for progress tracking.
 *
 * <p>Sessions are kept in memory for {@code sessionRetentionMinutes} after their last update so
 * observers can still read the terminal state.
 */
@ConfigurationProperties(prefix = "progress")
@Validated
public record ProgressProperties(
    @Positive int maxSessions,
    @Positive int sessionRetentionMinutes,
    @Positive int emitterQueueSize) {}
