package com.scholary.captions.chunking;

/**
 * A time range in seconds.
 *
 * <p>Used for chunk windows, gaps and audio extraction requests. All times are in seconds with
 * fractional precision.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Check if this range contains a given time point.
   *
   * @param time the time to check
   * @return true if time is within [start, end]
   */
  public boolean contains(double time) {
    return time >= start && time <= end;
  }

  /**
   * Clamp a time point into this range.
   *
   * @param time the time to clamp
   * @return the nearest time inside [start, end]
   */
  public double clamp(double time) {
    return Math.max(start, Math.min(end, time));
  }
}
