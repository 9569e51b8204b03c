package com.scholary.captions.transcript;

import com.scholary.captions.segment.Segment;
import com.scholary.captions.understanding.TokenUsage;
import java.util.List;

/**
 * Result of transcribing one chunk.
 *
 * <p>Segments are already in global coordinates. A failed chunk has no segments and a failure
 * reason; its span is left for the gap pass.
 */
public record ChunkTranscript(
    int chunkIndex,
    double start,
    double end,
    List<Segment> segments,
    TokenUsage usage,
    String failureReason) {

  public ChunkTranscript {
    segments = List.copyOf(segments);
    usage = usage == null ? TokenUsage.ZERO : usage;
  }

  public static ChunkTranscript succeeded(
      int chunkIndex, double start, double end, List<Segment> segments, TokenUsage usage) {
    return new ChunkTranscript(chunkIndex, start, end, segments, usage, null);
  }

  public static ChunkTranscript failed(
      int chunkIndex, double start, double end, TokenUsage usage, String reason) {
    return new ChunkTranscript(chunkIndex, start, end, List.of(), usage, reason);
  }

  public boolean failed() {
    return failureReason != null;
  }
}
