package com.scholary.captions.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.captions.api.CaptionRequest;
import org.junit.jupiter.api.Test;

class CaptionJobTest {

  private static final CaptionRequest REQUEST =
      new CaptionRequest("media", "a.mp3", "srt", null, null, null, null, null);

  @Test
  void requestCancellation_shouldCancelPendingJobImmediately() {
    CaptionJob job = new CaptionJob("job-1", REQUEST);

    job.requestCancellation();

    assertThat(job.getStatus()).isEqualTo(CaptionJob.Status.CANCELLED);
    assertThat(job.isFinished()).isTrue();
    assertThat(job.getCancellation().isCancelled()).isTrue();
  }

  @Test
  void requestCancellation_shouldOnlyFlagRunningJob() {
    CaptionJob job = new CaptionJob("job-1", REQUEST);
    job.setStatus(CaptionJob.Status.PROCESSING);

    job.requestCancellation();

    assertThat(job.getStatus()).isEqualTo(CaptionJob.Status.PROCESSING);
    assertThat(job.getCancellation().isCancelled()).isTrue();
  }

  @Test
  void throwIfCancelled_shouldNameTheCallSite() {
    CancellationToken token = new CancellationToken();
    token.throwIfCancelled("chunk-0");

    token.cancel();

    assertThatThrownBy(() -> token.throwIfCancelled("chunk-3"))
        .isInstanceOf(CaptionJobCancelledException.class)
        .hasMessageContaining("chunk-3");
  }

  @Test
  void repository_shouldStoreAndFindJobs() {
    JobRepository repository = new JobRepository(10, 5);
    CaptionJob job = new CaptionJob("job-2", REQUEST);

    repository.save(job);

    assertThat(repository.findById("job-2")).containsSame(job);
    assertThat(repository.findById("job-3")).isEmpty();
  }

  @Test
  void findActive_shouldSkipFinishedJobs() {
    JobRepository repository = new JobRepository(10, 5);
    CaptionJob running = new CaptionJob("running", REQUEST);
    running.setStatus(CaptionJob.Status.PROCESSING);
    CaptionJob pending = new CaptionJob("pending", REQUEST);
    CaptionJob done = new CaptionJob("done", REQUEST);
    done.setStatus(CaptionJob.Status.COMPLETED);
    CaptionJob cancelled = new CaptionJob("cancelled", REQUEST);
    cancelled.requestCancellation();

    repository.save(running);
    repository.save(pending);
    repository.save(done);
    repository.save(cancelled);

    assertThat(repository.findActive())
        .extracting(CaptionJob::getJobId)
        .containsExactlyInAnyOrder("running", "pending");
  }
}
