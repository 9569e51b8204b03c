package com.scholary.captions.segment;

import com.scholary.captions.chunking.TimeRange;
import java.util.Objects;

/**
 * One timed, classified caption interval on the global timeline.
 *
 * <p>Text is stored without decoration. The renderer adds the music/sound/silence markers for the
 * target format.
 */
public record Segment(
    double start, double end, String text, ContentType contentType, SegmentSource source) {

  public Segment {
    if (Double.isNaN(start) || Double.isNaN(end)) {
      throw new IllegalArgumentException("Segment times must be numbers");
    }
    if (start < 0) {
      throw new IllegalArgumentException("Segment start cannot be negative: " + start);
    }
    if (end <= start) {
      throw new IllegalArgumentException(
          String.format("Segment end (%.3f) must be after start (%.3f)", end, start));
    }
    Objects.requireNonNull(contentType, "contentType");
    Objects.requireNonNull(source, "source");
    text = text == null ? "" : text.trim();
  }

  public double duration() {
    return end - start;
  }

  public TimeRange range() {
    return new TimeRange(start, end);
  }

  public Segment withEnd(double newEnd) {
    return new Segment(start, newEnd, text, contentType, source);
  }

  public Segment withBounds(double newStart, double newEnd) {
    return new Segment(newStart, newEnd, text, contentType, source);
  }
}
