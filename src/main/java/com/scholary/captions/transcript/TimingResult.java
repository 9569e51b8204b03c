package com.scholary.captions.transcript;

import com.scholary.captions.segment.Segment;
import com.scholary.captions.understanding.TokenUsage;
import java.util.List;

/**
 * Output of the timing pass.
 *
 * @param segments the segments to render; the input unchanged unless {@code applied}
 * @param applied whether the optimized timing was accepted
 * @param usage tokens spent
 * @param fallbackReason why the input was kept, null when applied
 */
public record TimingResult(
    List<Segment> segments, boolean applied, TokenUsage usage, String fallbackReason) {

  public TimingResult {
    segments = List.copyOf(segments);
    usage = usage == null ? TokenUsage.ZERO : usage;
  }

  static TimingResult applied(List<Segment> segments, TokenUsage usage) {
    return new TimingResult(segments, true, usage, null);
  }

  static TimingResult unchanged(List<Segment> segments, TokenUsage usage, String reason) {
    return new TimingResult(segments, false, usage, reason);
  }
}
