package com.scholary.captions.transcript;

import com.scholary.captions.config.ConfigurationException;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.Timeline;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Finds stretches of audio that no segment explains. */
@Component
public class GapDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(GapDetector.class);

  /**
   * Walk a sorted segment list, including the head before the first segment and the tail after
   * the last one.
   *
   * @param segments sorted, non-overlapping segments
   * @param totalDuration length of the source audio
   * @param thresholdSeconds uncovered spans longer than this become gaps
   * @return gaps in time order, indexed from 0
   */
  public List<Gap> detect(List<Segment> segments, double totalDuration, double thresholdSeconds) {
    if (thresholdSeconds < 0 || Double.isNaN(thresholdSeconds)) {
      throw new ConfigurationException("Gap threshold cannot be negative: " + thresholdSeconds);
    }

    List<Gap> gaps = new ArrayList<>();
    double covered = 0.0;
    for (Segment segment : segments) {
      addIfGap(gaps, covered, segment.start(), thresholdSeconds);
      covered = Math.max(covered, segment.end());
    }
    addIfGap(gaps, covered, totalDuration, thresholdSeconds);

    LOGGER.info(
        "Detected {} gaps longer than {}s across {}s of audio",
        gaps.size(),
        thresholdSeconds,
        totalDuration);
    return gaps;
  }

  private static void addIfGap(List<Gap> gaps, double from, double to, double threshold) {
    if (to - from > Math.max(threshold, Timeline.MIN_DURATION) + Timeline.EPSILON) {
      gaps.add(new Gap(gaps.size(), from, to));
    }
  }
}
