package com.scholary.captions.media;

import com.scholary.captions.chunking.TimeRange;
import java.nio.file.Path;

/**
 * Interface for the media processing collaborator.
 *
 * <p>The engine never decodes audio itself. It asks for durations and for encoded audio of exact
 * time ranges.
 */
public interface MediaExtractor {

  /**
   * Measure the duration of the audio track.
   *
   * @param source the media file
   * @return duration in seconds
   * @throws MediaExtractionException if the duration cannot be read
   */
  double probeDuration(Path source);

  /**
   * Extract one range of the audio track.
   *
   * @param source the media file
   * @param range the range in seconds
   * @return mono audio for the range in a fixed format
   * @throws MediaExtractionException if extraction fails
   */
  AudioClip extract(Path source, TimeRange range);
}
