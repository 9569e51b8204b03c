package com.scholary.captions.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>Extracted audio is always re-encoded to the same sample format so every request to the audio
 * understanding service looks alike.
 */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive int timeoutSeconds,
    @PositiveOrZero int maxRetries,
    @NotBlank String tempDir) {}
