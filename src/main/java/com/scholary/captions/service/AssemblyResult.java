package com.scholary.captions.service;

import com.scholary.captions.segment.Segment;
import com.scholary.captions.transcript.GapFillResult;
import com.scholary.captions.understanding.UsageReport;
import java.util.List;

/**
 * Output of one engine run.
 *
 * @param segments the final timeline snapshot
 * @param usage token usage by phase
 * @param partial true when the run was cancelled and only merged chunk results are included
 * @param chunkCount chunks planned
 * @param failedChunks indexes of chunks that contributed nothing
 * @param cachedChunks chunks taken from the cache
 * @param gaps gap pass summary
 * @param optimizationApplied whether the timing pass output was kept
 * @param optimizationNote why it was not kept, or null
 */
public record AssemblyResult(
    List<Segment> segments,
    UsageReport usage,
    boolean partial,
    int chunkCount,
    List<Integer> failedChunks,
    int cachedChunks,
    GapFillResult gaps,
    boolean optimizationApplied,
    String optimizationNote) {

  public AssemblyResult {
    segments = List.copyOf(segments);
    failedChunks = List.copyOf(failedChunks);
  }
}
