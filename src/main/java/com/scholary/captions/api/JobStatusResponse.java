package com.scholary.captions.api;

import com.scholary.captions.job.CaptionJob;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a job and includes the result once completed. A cancelled job that
 * asked for partial results carries the partial result.
 */
public record JobStatusResponse(
    String jobId, CaptionJob.Status status, Integer progress, CaptionResponse result, String error) {

  public static JobStatusResponse from(CaptionJob job) {
    return new JobStatusResponse(
        job.getJobId(), job.getStatus(), job.getProgress(), job.getResult(), job.getError());
  }
}
