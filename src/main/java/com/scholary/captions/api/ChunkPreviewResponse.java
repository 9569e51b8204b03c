package com.scholary.captions.api;

import com.scholary.captions.chunking.Chunk;
import java.util.List;

/** Planned chunk windows for a duration. */
public record ChunkPreviewResponse(
    double totalDurationSeconds, int chunkCount, List<ChunkPlan> chunks) {

  public record ChunkPlan(int index, double start, double end, double nominalEnd) {

    static ChunkPlan of(Chunk chunk) {
      return new ChunkPlan(chunk.index(), chunk.start(), chunk.end(), chunk.nominalEnd());
    }
  }
}
