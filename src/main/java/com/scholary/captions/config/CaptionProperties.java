package com.scholary.captions.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for caption assembly.
 *
 * <p>Controls default chunking, the gap threshold, the readability rules of the timing pass, and
 * resource allocation for jobs.
 */
@ConfigurationProperties(prefix = "captions")
@Validated
public record CaptionProperties(
    @NotNull @Valid ChunkingProperties chunking,
    @NotNull @Valid GapProperties gaps,
    @NotNull @Valid TimingProperties timing,
    @NotNull @Valid AuditProperties audit,
    @NotNull @Valid CacheProperties cache,
    @Positive int workerThreads,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @NotBlank String tempDir) {

  public record ChunkingProperties(
      @Positive double chunkSeconds,
      @PositiveOrZero double overlapSeconds,
      @Positive int maxSourceDurationHours) {}

  public record GapProperties(@PositiveOrZero double thresholdSeconds) {}

  /**
   * Readability rules applied after the collaborator's timing pass.
   *
   * @param enabled whether the timing pass runs at all
   * @param minDurationSeconds shortest time a caption stays on screen
   * @param maxCharsPerSecond reading speed ceiling
   * @param minGapSeconds blank interval wanted between consecutive captions
   * @param fragmentJoinSeconds largest pause between speech fragments that still counts as one
   *     utterance
   * @param maxCaptionSeconds merged captions never grow past this
   */
  public record TimingProperties(
      boolean enabled,
      @Positive double minDurationSeconds,
      @Positive double maxCharsPerSecond,
      @PositiveOrZero double minGapSeconds,
      @PositiveOrZero double fragmentJoinSeconds,
      @Positive double maxCaptionSeconds) {}

  public record AuditProperties(boolean enabled, String bucket) {}

  public record CacheProperties(@Positive int maxSize, @Positive int ttlHours) {}
}
