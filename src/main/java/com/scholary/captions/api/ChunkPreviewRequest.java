package com.scholary.captions.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for previewing chunk boundaries for a given duration without processing anything.
 *
 * <p>Null {@code chunkSeconds} or {@code overlapSeconds} mean the configured defaults.
 */
public record ChunkPreviewRequest(
    @NotNull @Positive Double durationSeconds,
    @Min(5) @Max(600) Integer chunkSeconds,
    @Min(0) @Max(30) Integer overlapSeconds) {}
