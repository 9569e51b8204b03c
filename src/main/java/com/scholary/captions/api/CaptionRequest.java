package com.scholary.captions.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request for captioning an audio or video file in object storage.
 *
 * <p>Captioning is asynchronous: the response carries a job ID, and the client polls
 * /api/jobs/{id}. A null {@code chunkSeconds} or {@code overlapSeconds} means the
 * configured default. {@code refresh} discards chunk transcriptions cached for this source by
 * earlier jobs.
 */
public record CaptionRequest(
    @NotBlank String bucket,
    @NotBlank String key,
    @Pattern(regexp = "(?i)srt|vtt|webvtt") String format,
    @Min(5) @Max(600) Integer chunkSeconds,
    @Min(0) @Max(30) Integer overlapSeconds,
    Boolean allowPartial,
    Boolean save,
    Boolean refresh) {

  public CaptionRequest {
    if (format == null) {
      format = "srt";
    }
    if (allowPartial == null) {
      allowPartial = false;
    }
    if (save == null) {
      save = true;
    }
    if (refresh == null) {
      refresh = false;
    }
  }
}
