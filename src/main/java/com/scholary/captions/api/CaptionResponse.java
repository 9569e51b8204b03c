package com.scholary.captions.api;

import com.scholary.captions.segment.Segment;
import com.scholary.captions.understanding.UsageReport;
import java.util.List;

/**
 * Result of a finished caption job.
 *
 * <p>Contains the rendered document, the segments behind it, token usage, diagnostics, and
 * storage locations if saved.
 */
public record CaptionResponse(
    String jobId,
    String format,
    String caption,
    List<Segment> segments,
    UsageReport usage,
    Diagnostics diagnostics,
    StorageInfo storage,
    boolean partial) {

  public record StorageInfo(
      String bucket, String captionKey, String jsonKey, String captionUrl, String jsonUrl) {}

  /**
   * How the job went.
   *
   * @param durationSeconds length of the source audio
   * @param chunkCount chunks planned
   * @param failedChunks indexes of chunks that contributed no segments
   * @param cachedChunks chunks reused from the chunk cache
   * @param gapsDetected gaps found after the merge
   * @param gapsFilled gaps classified by the service
   * @param silenceFallbacks gaps filled with synthesized silence
   * @param optimizationApplied whether the timing pass result was kept
   * @param optimizationNote why the timing pass result was not kept, if it wasn't
   * @param processingTimeMs wall time of the job
   */
  public record Diagnostics(
      double durationSeconds,
      int chunkCount,
      List<Integer> failedChunks,
      int cachedChunks,
      int gapsDetected,
      int gapsFilled,
      int silenceFallbacks,
      boolean optimizationApplied,
      String optimizationNote,
      long processingTimeMs) {}
}
