package com.scholary.captions.service;

import com.scholary.captions.api.CaptionResponse;
import com.scholary.captions.job.CaptionJob;
import com.scholary.captions.job.CaptionJob.Status;
import com.scholary.captions.job.CaptionJobCancelledException;
import com.scholary.captions.job.JobRepository;
import com.scholary.captions.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs caption jobs on the async job executor and keeps their status current.
 *
 * <p>Lives in its own bean so that calls from the controller go through the async proxy.
 */
@Service
public class CaptionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionJobRunner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final CaptionService captionService;
  private final JobRepository jobRepository;

  public CaptionJobRunner(CaptionService captionService, JobRepository jobRepository) {
    this.captionService = captionService;
    this.jobRepository = jobRepository;
  }

  @Async("taskExecutor")
  public void runAsync(CaptionJob job) {
    run(job);
  }

  /** Run a job on the current thread. */
  public void run(CaptionJob job) {
    if (job.getCancellation().isCancelled()) {
      LOGGER.info("Job {} was cancelled before it started", job.getJobId());
      job.setStatus(Status.CANCELLED);
      jobRepository.save(job);
      return;
    }

    LOGGER.info("Starting async processing for job: {}", job.getJobId());
    job.setStatus(Status.PROCESSING);
    jobRepository.save(job);

    try {
      CaptionResponse result =
          captionService.caption(
              job.getJobId(),
              job.getRequest(),
              job.getCancellation(),
              (phase, percent) -> {
                job.setProgress(percent);
                STRUCTURED_LOGGER.logJobProgress(job.getJobId(), phase, percent, 100);
              });

      job.setResult(result);
      job.setProgress(100);
      job.setStatus(result.partial() ? Status.CANCELLED : Status.COMPLETED);
      LOGGER.info("Finished job {}: status={}", job.getJobId(), job.getStatus());

    } catch (CaptionJobCancelledException e) {
      LOGGER.info("Job {} cancelled: {}", job.getJobId(), e.getMessage());
      job.setStatus(Status.CANCELLED);
      job.setError(e.getMessage());

    } catch (Exception e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
    }
    jobRepository.save(job);
  }
}
