package com.scholary.captions.transcript;

import com.scholary.captions.config.CaptionProperties.TimingProperties;
import com.scholary.captions.segment.ContentType;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.Timeline;
import java.util.ArrayList;
import java.util.List;

/**
 * Local readability rules applied on top of the collaborator's timing pass.
 *
 * <ol>
 *   <li>Adjacent speech fragments, both shorter than the minimum duration and at most {@code
 *       fragmentJoinSeconds} apart, are joined into one caption, as long as the result stays within
 *       {@code maxCaptionSeconds}.
 *   <li>Short captions are extended towards the minimum duration and the reading-speed
 *       requirement, but never closer than {@code minGapSeconds} to the next caption or past the
 *       end of the audio.
 *   <li>Captions that sit closer than {@code minGapSeconds} to the next one are cut back, if they
 *       keep at least the minimum duration.
 * </ol>
 *
 * <p>Input and output are sorted and non-overlapping. Text is never dropped.
 */
public class ReadabilityPass {

  private final TimingProperties rules;

  public ReadabilityPass(TimingProperties rules) {
    this.rules = rules;
  }

  public List<Segment> apply(List<Segment> segments, double totalDuration) {
    List<Segment> result = mergeFragments(segments);
    extendShortCaptions(result, totalDuration);
    enforceSpacing(result);
    return result;
  }

  List<Segment> mergeFragments(List<Segment> segments) {
    List<Segment> result = new ArrayList<>(segments.size());
    for (Segment next : segments) {
      if (!result.isEmpty()) {
        Segment last = result.get(result.size() - 1);
        if (isFragmentPair(last, next)) {
          result.set(
              result.size() - 1,
              new Segment(
                  last.start(),
                  next.end(),
                  joinText(last.text(), next.text()),
                  ContentType.SPEECH,
                  last.source()));
          continue;
        }
      }
      result.add(next);
    }
    return result;
  }

  void extendShortCaptions(List<Segment> segments, double totalDuration) {
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      double wanted =
          Math.max(rules.minDurationSeconds(), segment.text().length() / rules.maxCharsPerSecond());
      if (segment.duration() >= wanted) {
        continue;
      }
      double limit =
          i + 1 < segments.size()
              ? segments.get(i + 1).start() - rules.minGapSeconds()
              : totalDuration;
      double newEnd = Math.min(segment.start() + wanted, limit);
      if (newEnd > segment.end()) {
        segments.set(i, segment.withEnd(newEnd));
      }
    }
  }

  void enforceSpacing(List<Segment> segments) {
    for (int i = 0; i + 1 < segments.size(); i++) {
      Segment segment = segments.get(i);
      double nextStart = segments.get(i + 1).start();
      if (nextStart - segment.end() >= rules.minGapSeconds() - Timeline.EPSILON) {
        continue;
      }
      double newEnd = nextStart - rules.minGapSeconds();
      if (newEnd - segment.start() >= rules.minDurationSeconds() - Timeline.EPSILON) {
        segments.set(i, segment.withEnd(newEnd));
      }
    }
  }

  private boolean isFragmentPair(Segment last, Segment next) {
    return last.contentType() == ContentType.SPEECH
        && next.contentType() == ContentType.SPEECH
        && last.duration() < rules.minDurationSeconds()
        && next.duration() < rules.minDurationSeconds()
        && next.start() - last.end() <= rules.fragmentJoinSeconds() + Timeline.EPSILON
        && next.end() - last.start() <= rules.maxCaptionSeconds() + Timeline.EPSILON;
  }

  private static String joinText(String first, String second) {
    if (first.isEmpty()) {
      return second;
    }
    if (second.isEmpty()) {
      return first;
    }
    return first + " " + second;
  }
}
