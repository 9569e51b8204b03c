package com.scholary.captions.transcript;

import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.Timeline;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges per-chunk results into one sorted, non-overlapping segment list.
 *
 * <p>Segments are ordered by start time, ties broken by chunk index. When two consecutive segments
 * overlap, the later-starting one keeps the disputed interval and the earlier one is cut back to
 * where the later one begins. A segment cut down to less than a millisecond is dropped. The order
 * in which chunk results arrived plays no part.
 */
@Component
public class TimelineMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineMerger.class);

  private record Entry(int chunkIndex, Segment segment) {}

  /**
   * Merge chunk transcripts.
   *
   * @param transcripts per-chunk results in any order
   * @param totalDuration length of the source audio
   * @return segments ready for {@link Timeline#replaceAll}
   */
  public List<Segment> merge(List<ChunkTranscript> transcripts, double totalDuration) {
    List<Entry> entries = new ArrayList<>();
    for (ChunkTranscript transcript : transcripts) {
      for (Segment segment : transcript.segments()) {
        double start = Math.max(0, segment.start());
        double end = Math.min(totalDuration, segment.end());
        if (end - start < Timeline.MIN_DURATION) {
          LOGGER.debug(
              "Dropping segment outside audio bounds or under 1ms: [{}-{}]",
              segment.start(),
              segment.end());
          continue;
        }
        entries.add(new Entry(transcript.chunkIndex(), segment.withBounds(start, end)));
      }
    }
    entries.sort(
        Comparator.comparingDouble((Entry e) -> e.segment().start())
            .thenComparingInt(Entry::chunkIndex));

    List<Segment> merged = new ArrayList<>(entries.size());
    int truncated = 0;
    int dropped = 0;

    for (Entry entry : entries) {
      Segment next = entry.segment();
      if (!merged.isEmpty()) {
        Segment previous = merged.get(merged.size() - 1);
        if (previous.end() > next.start()) {
          merged.remove(merged.size() - 1);
          if (next.start() - previous.start() >= Timeline.MIN_DURATION) {
            merged.add(previous.withEnd(next.start()));
            truncated++;
          } else {
            dropped++;
          }
        }
      }
      merged.add(next);
    }

    LOGGER.info(
        "Merged {} chunk transcripts into {} segments ({} truncated, {} superseded)",
        transcripts.size(),
        merged.size(),
        truncated,
        dropped);
    return merged;
  }
}
