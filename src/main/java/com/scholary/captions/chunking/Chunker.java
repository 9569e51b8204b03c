package com.scholary.captions.chunking;

import com.scholary.captions.config.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed-size chunking with an optional trailing overlap.
 *
 * <p>Chunk {@code i} starts at {@code i * chunkSeconds}. Without overlap the chunks abut exactly
 * and cover {@code [0, duration]}. With overlap every chunk except the last reaches {@code
 * overlapSeconds} into the next one:
 *
 * <pre>
 * duration=90, chunk=30, overlap=0:  [0,30) [30,60) [60,90)
 * duration=70, chunk=30, overlap=2:  [0,32) [30,62) [60,70)
 * </pre>
 */
@Component
public class Chunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Chunker.class);

  /**
   * Plan the chunk windows for an audio track.
   *
   * @param totalDuration total audio duration in seconds
   * @param chunkSeconds chunk size in seconds
   * @param overlapSeconds extra audio appended to each chunk, 0 for abutting chunks
   * @return ordered chunks covering the whole track
   * @throws ConfigurationException if any parameter is out of range
   */
  public List<Chunk> planChunks(double totalDuration, double chunkSeconds, double overlapSeconds) {
    if (!(totalDuration > 0)) {
      throw new ConfigurationException("Audio duration must be positive: " + totalDuration);
    }
    if (!(chunkSeconds > 0)) {
      throw new ConfigurationException("Chunk size must be positive: " + chunkSeconds);
    }
    if (overlapSeconds < 0 || overlapSeconds >= chunkSeconds) {
      throw new ConfigurationException(
          String.format(
              "Overlap (%ss) must be >= 0 and less than chunk size (%ss)",
              overlapSeconds, chunkSeconds));
    }

    LOGGER.info(
        "Planning chunks: totalDuration={}s, chunkSeconds={}s, overlap={}s",
        totalDuration,
        chunkSeconds,
        overlapSeconds);

    List<Chunk> chunks = new ArrayList<>();
    int index = 0;
    double start = 0.0;

    while (start < totalDuration) {
      double nominalEnd = Math.min((index + 1) * chunkSeconds, totalDuration);
      double end = Math.min(nominalEnd + overlapSeconds, totalDuration);
      chunks.add(new Chunk(index, start, end, nominalEnd));

      LOGGER.debug("Chunk {}: {}s - {}s (nominal end {}s)", index, start, end, nominalEnd);

      index++;
      // Multiply instead of accumulating to avoid drift on long tracks
      start = index * chunkSeconds;
    }

    LOGGER.info("Planned {} chunks", chunks.size());
    return chunks;
  }
}
