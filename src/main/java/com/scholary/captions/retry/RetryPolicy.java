package com.scholary.captions.retry;

import com.scholary.captions.logging.StructuredLogger;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff and jitter.
 *
 * <p>One policy object parameterizes every collaborator call site (chunk transcription, gap
 * analysis, timing optimization, audio extraction). Only {@link IOException} is retried; anything
 * else, including interruption, propagates on the first occurrence.
 *
 * <p>Backoff for attempt {@code n} (1-based) is {@code initialBackoff * 2^(n-1)} capped at {@code
 * maxBackoff}, plus up to 50% random jitter.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("Backoff must be >= 0 and maxBackoff >= initialBackoff");
    }
  }

  /** A call that may fail transiently. */
  @FunctionalInterface
  public interface RetryableCall<T> {
    T call() throws IOException, InterruptedException;
  }

  /**
   * Run a call, retrying transient failures.
   *
   * @param callSite label used in logs
   * @param call the call
   * @return the call's result
   * @throws IOException the last failure once all attempts are used up
   * @throws InterruptedException if interrupted while calling or backing off
   */
  public <T> T execute(String callSite, RetryableCall<T> call)
      throws IOException, InterruptedException {
    return execute(callSite, () -> false, call);
  }

  /**
   * Run a call, retrying transient failures until the caller gives up.
   *
   * <p>{@code cancelled} is checked after each failure and again after the backoff; once it
   * returns true no further attempt is made and the last failure is rethrown.
   *
   * @param callSite label used in logs
   * @param cancelled tells whether the caller still wants a result
   * @param call the call
   * @return the call's result
   * @throws IOException the last failure once attempts are used up or the caller gave up
   * @throws InterruptedException if interrupted while calling or backing off
   */
  public <T> T execute(String callSite, BooleanSupplier cancelled, RetryableCall<T> call)
      throws IOException, InterruptedException {
    IOException lastException = null;
    int attempt = 0;

    while (attempt < maxAttempts) {
      attempt++;
      try {
        return call.call();
      } catch (IOException e) {
        lastException = e;
        if (attempt == maxAttempts || cancelled.getAsBoolean()) {
          break;
        }
        long backoffMs = backoffMillis(attempt);
        STRUCTURED_LOGGER.logCollaboratorRetry(
            callSite, attempt, maxAttempts, e.getClass().getSimpleName(), e.getMessage());
        LOGGER.debug("Backing off {}ms before attempt {} of {}", backoffMs, attempt + 1, callSite);
        Thread.sleep(backoffMs);
        if (cancelled.getAsBoolean()) {
          break;
        }
      }
    }

    if (attempt < maxAttempts) {
      LOGGER.info("Giving up on {} after {} attempts: cancelled", callSite, attempt);
    }
    STRUCTURED_LOGGER.logCollaboratorFailed(
        callSite,
        attempt,
        lastException.getClass().getSimpleName(),
        lastException.getMessage());
    throw lastException;
  }

  /** Delay before the retry that follows the given failed attempt (1-based). */
  long backoffMillis(int attempt) {
    long base = initialBackoff.toMillis();
    long capped = Math.min(maxBackoff.toMillis(), base << Math.min(attempt - 1, 30));
    long jitter = capped > 1 ? ThreadLocalRandom.current().nextLong(capped / 2 + 1) : 0;
    return capped + jitter;
  }
}
