package com.scholary.captions.understanding;

/**
 * Exception thrown when the audio understanding service cannot be reached or answers with an error.
 *
 * <p>Callers treat this as missing data for the chunk or gap they were working on. It never fails a
 * whole job.
 */
public class UnderstandingException extends RuntimeException {

  public UnderstandingException(String message) {
    super(message);
  }

  public UnderstandingException(String message, Throwable cause) {
    super(message, cause);
  }
}
