package com.scholary.captions.understanding;

/** Token accounting reported by the audio understanding service for one or more calls. */
public record TokenUsage(long promptTokens, long completionTokens) {

  public static final TokenUsage ZERO = new TokenUsage(0, 0);

  public TokenUsage plus(TokenUsage other) {
    if (other == null) {
      return this;
    }
    return new TokenUsage(
        promptTokens + other.promptTokens, completionTokens + other.completionTokens);
  }

  public long totalTokens() {
    return promptTokens + completionTokens;
  }
}
