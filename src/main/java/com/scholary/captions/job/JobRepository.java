package com.scholary.captions.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Caption jobs held in memory, keyed by job ID.
 *
 * <p>Entries expire a fixed time after they were last read or written, so a job that is still
 * being polled stays available while abandoned ones drop out.
 */
@Repository
public class JobRepository {

  private final Cache<String, CaptionJob> jobs;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {
    this.jobs =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(CaptionJob job) {
    jobs.put(job.getJobId(), job);
  }

  public Optional<CaptionJob> findById(String jobId) {
    return Optional.ofNullable(jobs.getIfPresent(jobId));
  }

  /** Jobs that are pending or processing, oldest first. */
  public List<CaptionJob> findActive() {
    return jobs.asMap().values().stream()
        .filter(job -> !job.isFinished())
        .sorted(Comparator.comparing(CaptionJob::getCreatedAt))
        .collect(Collectors.toList());
  }
}
