package com.scholary.captions.transcript;

import com.scholary.captions.understanding.TokenUsage;

/**
 * Summary of one gap pass.
 *
 * @param detected gaps found
 * @param filled gaps that got a classified segment from the service
 * @param silenceFallbacks gaps filled with synthesized silence
 * @param usage tokens spent on gap analysis
 */
public record GapFillResult(int detected, int filled, int silenceFallbacks, TokenUsage usage) {

  public static GapFillResult none() {
    return new GapFillResult(0, 0, 0, TokenUsage.ZERO);
  }
}
