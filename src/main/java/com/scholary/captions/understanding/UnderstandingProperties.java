package com.scholary.captions.understanding;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the audio understanding client.
 *
 * <p>These control where the generateContent endpoint lives, which model is asked, and how long we
 * wait and retry.
 */
@ConfigurationProperties(prefix = "understanding")
@Validated
public record UnderstandingProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @PositiveOrZero int maxRetries,
    @Positive long initialBackoffMillis,
    @Positive long maxBackoffMillis) {}
