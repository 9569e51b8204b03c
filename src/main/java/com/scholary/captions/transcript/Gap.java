package com.scholary.captions.transcript;

import com.scholary.captions.chunking.TimeRange;

/**
 * An interval no segment covers after the chunk pass.
 *
 * @param index position among the gaps of one detection run
 * @param start gap start in seconds
 * @param end gap end in seconds
 */
public record Gap(int index, double start, double end) {

  public double duration() {
    return end - start;
  }

  public TimeRange range() {
    return new TimeRange(start, end);
  }
}
