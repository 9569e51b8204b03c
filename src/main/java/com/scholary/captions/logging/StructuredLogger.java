package com.scholary.captions.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call so they can be
 * queried by field in the log store. Recoverable failures always carry the chunk or gap index and
 * the time range, which is what post-hoc audits search by.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, double start, double end) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug("Chunk started: index={}, range=[{}-{}]", chunkIndex, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(
      int chunkIndex, double start, double end, int segmentCount, long elapsedMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("segmentCount", String.valueOf(segmentCount));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Chunk finished: index={}, range=[{}-{}], segments={}, took={}ms",
          chunkIndex,
          start,
          end,
          segmentCount,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a chunk that contributed nothing; the gap pass will cover its span. */
  public void logChunkFailed(int chunkIndex, double start, double end, String reason) {
    try {
      MDC.put("event_type", "chunk_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("errorType", reason);

      logger.warn(
          "Chunk yielded no segments, leaving span to gap fill: index={}, range=[{}-{}], reason={}",
          chunkIndex,
          start,
          end,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log gap filled event. */
  public void logGapFilled(
      int gapIndex, double start, double end, String contentType, boolean fallback) {
    try {
      MDC.put("event_type", "gap_filled");
      MDC.put("gap_index", String.valueOf(gapIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("contentType", contentType);
      MDC.put("fallback", String.valueOf(fallback));

      if (fallback) {
        logger.warn(
            "Gap filled with fallback: index={}, range=[{}-{}], type={}",
            gapIndex,
            start,
            end,
            contentType);
      } else {
        logger.debug(
            "Gap filled: index={}, range=[{}-{}], type={}", gapIndex, start, end, contentType);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log collaborator retry event. */
  public void logCollaboratorRetry(
      String callSite, int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "collaborator_retry");
      MDC.put("callSite", callSite);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Collaborator retry: callSite={}, attempt={}/{}, error={}, message={}",
          callSite,
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log collaborator failure event. */
  public void logCollaboratorFailed(
      String callSite, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "collaborator_failed");
      MDC.put("callSite", callSite);
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Collaborator failed: callSite={}, maxAttempts={}, error={}, message={}",
          callSite,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log that the optimizer output was discarded. */
  public void logOptimizerFallback(int segmentCount, String reason) {
    try {
      MDC.put("event_type", "optimizer_fallback");
      MDC.put("segmentCount", String.valueOf(segmentCount));
      MDC.put("errorType", reason);

      logger.warn(
          "Timing optimization discarded, keeping {} segments unchanged: {}",
          segmentCount,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, String phase, int done, int total) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("phase", phase);
      MDC.put("done", String.valueOf(done));
      MDC.put("total", String.valueOf(total));

      logger.info("Job progress: jobId={}, phase={}, {}/{}", jobId, phase, done, total);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String bucket, String key) {
    MDC.put("jobId", jobId);
    MDC.put("bucket", bucket);
    MDC.put("key", key);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("bucket");
    MDC.remove("key");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("gap_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("segmentCount");
    MDC.remove("elapsedMs");
    MDC.remove("contentType");
    MDC.remove("fallback");
    MDC.remove("callSite");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
    MDC.remove("phase");
    MDC.remove("done");
    MDC.remove("total");
  }
}
