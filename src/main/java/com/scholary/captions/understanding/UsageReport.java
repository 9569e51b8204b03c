package com.scholary.captions.understanding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token usage of one job, split by phase.
 *
 * @param chunkTranscription calls made for chunk transcription
 * @param gapAnalysis calls made to classify gaps
 * @param timingOptimization the timing optimization call
 */
@JsonIgnoreProperties(value = "total", allowGetters = true)
public record UsageReport(
    TokenUsage chunkTranscription, TokenUsage gapAnalysis, TokenUsage timingOptimization) {

  public static final UsageReport EMPTY =
      new UsageReport(TokenUsage.ZERO, TokenUsage.ZERO, TokenUsage.ZERO);

  public UsageReport {
    chunkTranscription = chunkTranscription == null ? TokenUsage.ZERO : chunkTranscription;
    gapAnalysis = gapAnalysis == null ? TokenUsage.ZERO : gapAnalysis;
    timingOptimization = timingOptimization == null ? TokenUsage.ZERO : timingOptimization;
  }

  @JsonProperty("total")
  public TokenUsage total() {
    return chunkTranscription.plus(gapAnalysis).plus(timingOptimization);
  }
}
