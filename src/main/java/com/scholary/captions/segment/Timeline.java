package com.scholary.captions.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The ordered segment sequence for one captioning job.
 *
 * <p>A timeline is owned by a single engine run. Worker tasks never get a reference to it; they
 * hand their results back and the owner applies them through the synchronized mutators below, so
 * the sorted and non-overlapping invariant holds after every call.
 *
 * <p>Two segments may touch ({@code a.end == b.start}) but never overlap.
 */
public class Timeline {

  /** Tolerance for floating point comparisons of boundaries, well below a millisecond. */
  public static final double EPSILON = 1e-6;

  /** Shortest segment kept: caption timestamps have millisecond resolution. */
  public static final double MIN_DURATION = 0.001;

  private final double totalDuration;
  private final List<Segment> segments = new ArrayList<>();

  public Timeline(double totalDuration) {
    if (!(totalDuration > 0)) {
      throw new IllegalArgumentException("Timeline duration must be positive: " + totalDuration);
    }
    this.totalDuration = totalDuration;
  }

  public double totalDuration() {
    return totalDuration;
  }

  /**
   * Replace the whole content after validating it.
   *
   * @throws TimelineInvariantException if the new content breaks ordering, overlap or bounds
   */
  public synchronized void replaceAll(List<Segment> newSegments) {
    validate(newSegments, totalDuration);
    segments.clear();
    segments.addAll(newSegments);
  }

  /**
   * Insert one segment at its sorted position.
   *
   * @return the index the segment was inserted at
   * @throws TimelineInvariantException if the segment overlaps a neighbour or leaves the bounds
   */
  public synchronized int insert(Segment segment) {
    checkBounds(segment, totalDuration);

    int low = 0;
    int high = segments.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (segments.get(mid).start() < segment.start()) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }

    if (low > 0 && segments.get(low - 1).end() > segment.start() + EPSILON) {
      throw new TimelineInvariantException(
          String.format(
              "Segment [%.3f-%.3f] overlaps previous segment ending at %.3f",
              segment.start(), segment.end(), segments.get(low - 1).end()));
    }
    if (low < segments.size() && segment.end() > segments.get(low).start() + EPSILON) {
      throw new TimelineInvariantException(
          String.format(
              "Segment [%.3f-%.3f] overlaps next segment starting at %.3f",
              segment.start(), segment.end(), segments.get(low).start()));
    }

    segments.add(low, segment);
    return low;
  }

  /** Immutable copy of the current content, safe to hand to the renderer. */
  public synchronized List<Segment> snapshot() {
    return List.copyOf(segments);
  }

  public synchronized int size() {
    return segments.size();
  }

  public synchronized boolean isEmpty() {
    return segments.isEmpty();
  }

  /**
   * Check that a sequence could be accepted by a timeline of the given duration.
   *
   * @throws TimelineInvariantException describing the first violation found
   */
  public static void validate(List<Segment> candidate, double totalDuration) {
    Segment previous = null;
    for (int i = 0; i < candidate.size(); i++) {
      Segment current = candidate.get(i);
      checkBounds(current, totalDuration);
      if (previous != null) {
        if (current.start() + EPSILON < previous.start()) {
          throw new TimelineInvariantException(
              String.format(
                  "Segment %d starts at %.3f before segment %d at %.3f",
                  i, current.start(), i - 1, previous.start()));
        }
        if (previous.end() > current.start() + EPSILON) {
          throw new TimelineInvariantException(
              String.format(
                  "Segment %d [%.3f-%.3f] overlaps segment %d [%.3f-%.3f]",
                  i - 1, previous.start(), previous.end(), i, current.start(), current.end()));
        }
      }
      previous = current;
    }
  }

  private static void checkBounds(Segment segment, double totalDuration) {
    if (segment.duration() < MIN_DURATION - EPSILON) {
      throw new TimelineInvariantException(
          String.format(
              Locale.ROOT,
              "Segment [%.4f-%.4f] is shorter than one millisecond",
              segment.start(),
              segment.end()));
    }
    if (segment.end() > totalDuration + EPSILON) {
      throw new TimelineInvariantException(
          String.format(
              "Segment [%.3f-%.3f] ends after audio duration %.3f",
              segment.start(), segment.end(), totalDuration));
    }
  }
}
