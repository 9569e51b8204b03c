package com.scholary.captions.chunking;

/**
 * One analysis window of the source audio.
 *
 * <p>{@code end} is the end of the audio actually sent for analysis and includes any configured
 * overlap. {@code nominalEnd} is where the next chunk starts.
 */
public record Chunk(int index, double start, double end, double nominalEnd) {

  public Chunk(int index, double start, double end) {
    this(index, start, end, end);
  }

  public double duration() {
    return end - start;
  }

  public boolean hasOverlap() {
    return end > nominalEnd;
  }

  public TimeRange range() {
    return new TimeRange(start, end);
  }
}
