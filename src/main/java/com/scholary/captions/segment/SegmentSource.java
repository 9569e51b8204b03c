package com.scholary.captions.segment;

/**
 * Where a segment came from.
 *
 * <p>Only used for diagnostics and usage accounting. Ordering never looks at it.
 */
public record SegmentSource(Kind kind, int id) {

  public enum Kind {
    CHUNK_TRANSCRIPTION,
    GAP_FILL,
    TIMING_OPTIMIZATION,
    /** Read back from a rendered caption document. */
    IMPORTED
  }

  public static SegmentSource chunk(int chunkIndex) {
    return new SegmentSource(Kind.CHUNK_TRANSCRIPTION, chunkIndex);
  }

  public static SegmentSource gap(int gapIndex) {
    return new SegmentSource(Kind.GAP_FILL, gapIndex);
  }

  public static SegmentSource optimizer() {
    return new SegmentSource(Kind.TIMING_OPTIMIZATION, 0);
  }

  public static SegmentSource imported(int cueNumber) {
    return new SegmentSource(Kind.IMPORTED, cueNumber);
  }
}
