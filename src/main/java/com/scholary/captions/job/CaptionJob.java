package com.scholary.captions.job;

import com.scholary.captions.api.CaptionRequest;
import com.scholary.captions.api.CaptionResponse;
import java.time.Instant;

/**
 * An asynchronous caption job.
 *
 * <p>Tracks state, progress and result. Written by the job's worker thread and read by status
 * requests, so the mutable fields are volatile.
 */
public class CaptionJob {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
  }

  private final String jobId;
  private final CaptionRequest request;
  private final Instant createdAt;
  private final CancellationToken cancellation = new CancellationToken();

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile CaptionResponse result;
  private volatile String error;

  public CaptionJob(String jobId, CaptionRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public CaptionRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public CancellationToken getCancellation() {
    return cancellation;
  }

  /** Ask the job to stop. A job that has already finished is left as it is. */
  public void requestCancellation() {
    cancellation.cancel();
    if (status == Status.PENDING) {
      status = Status.CANCELLED;
    }
  }

  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.FAILED || status == Status.CANCELLED;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public CaptionResponse getResult() {
    return result;
  }

  public void setResult(CaptionResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
