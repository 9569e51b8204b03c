package com.scholary.captions.job;

/** Thrown when a job stops because cancellation was requested. */
public class CaptionJobCancelledException extends RuntimeException {

  public CaptionJobCancelledException(String message) {
    super(message);
  }
}
