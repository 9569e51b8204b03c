package com.scholary.captions.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Job-level cancellation flag.
 *
 * <p>Worker tasks check it before every collaborator call. Calls already in flight are not
 * interrupted; they finish and their results are either kept for a partial timeline or discarded.
 */
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** A token that is never cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * @throws CaptionJobCancelledException if cancellation was requested
   */
  public void throwIfCancelled(String where) {
    if (cancelled.get()) {
      throw new CaptionJobCancelledException("Job cancelled before " + where);
    }
  }
}
