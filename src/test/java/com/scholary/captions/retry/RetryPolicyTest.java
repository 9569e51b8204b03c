package com.scholary.captions.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void execute_shouldReturnFirstSuccess() throws Exception {
    RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(2));
    AtomicInteger calls = new AtomicInteger();

    String result =
        policy.execute(
            "test",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new IOException("transient");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(calls.get()).isEqualTo(3);
  }

  @Test
  void execute_shouldRethrowLastIOExceptionWhenExhausted() {
    RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, Duration.ZERO);
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    "test",
                    () -> {
                      throw new IOException("failure " + calls.incrementAndGet());
                    }))
        .isInstanceOf(IOException.class)
        .hasMessage("failure 2");
  }

  @Test
  void execute_shouldNotRetryRuntimeExceptions() {
    RetryPolicy policy = new RetryPolicy(5, Duration.ZERO, Duration.ZERO);
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    "test",
                    () -> {
                      calls.incrementAndGet();
                      throw new IllegalStateException("permanent");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void execute_shouldStopRetryingOnceCancelled() {
    RetryPolicy policy = new RetryPolicy(5, Duration.ZERO, Duration.ZERO);
    AtomicInteger calls = new AtomicInteger();
    AtomicBoolean cancelled = new AtomicBoolean();

    assertThatThrownBy(
            () ->
                policy.execute(
                    "test",
                    cancelled::get,
                    () -> {
                      cancelled.set(true);
                      throw new IOException("failure " + calls.incrementAndGet());
                    }))
        .isInstanceOf(IOException.class)
        .hasMessage("failure 1");
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void execute_shouldSkipAttemptWhenCancelledDuringBackoff() {
    RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(50), Duration.ofMillis(50));
    AtomicInteger calls = new AtomicInteger();
    AtomicInteger checks = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    "test",
                    () -> checks.incrementAndGet() > 1,
                    () -> {
                      throw new IOException("failure " + calls.incrementAndGet());
                    }))
        .isInstanceOf(IOException.class)
        .hasMessage("failure 1");
    assertThat(calls.get()).isEqualTo(1);
    assertThat(checks.get()).isEqualTo(2);
  }

  @Test
  void backoffMillis_shouldGrowExponentiallyUpToCap() {
    RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(1000));

    assertThat(policy.backoffMillis(1)).isBetween(100L, 150L);
    assertThat(policy.backoffMillis(2)).isBetween(200L, 300L);
    assertThat(policy.backoffMillis(3)).isBetween(400L, 600L);
    assertThat(policy.backoffMillis(8)).isBetween(1000L, 1500L);
  }

  @Test
  void constructor_shouldRejectInvalidSettings() {
    assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(2, Duration.ofSeconds(2), Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
