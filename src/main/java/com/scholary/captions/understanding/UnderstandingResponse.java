package com.scholary.captions.understanding;

/**
 * Raw reply from the audio understanding service.
 *
 * <p>The text is whatever the model produced. It may be JSON, JSON wrapped in prose or code fences,
 * or nothing useful at all; {@link ResponseParser} decides.
 */
public record UnderstandingResponse(String text, TokenUsage usage) {

  public UnderstandingResponse {
    text = text == null ? "" : text;
    usage = usage == null ? TokenUsage.ZERO : usage;
  }
}
