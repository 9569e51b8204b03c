package com.scholary.captions.segment;

/**
 * Thrown when a segment sequence is unsorted, overlapping or outside the audio duration.
 *
 * <p>The timing optimizer recovers from this by keeping the timeline it started with.
 */
public class TimelineInvariantException extends RuntimeException {

  public TimelineInvariantException(String message) {
    super(message);
  }
}
