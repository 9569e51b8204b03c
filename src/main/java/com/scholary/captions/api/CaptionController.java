package com.scholary.captions.api;

import com.scholary.captions.chunking.Chunk;
import com.scholary.captions.chunking.Chunker;
import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.config.ConfigurationException;
import com.scholary.captions.job.CaptionJob;
import com.scholary.captions.job.JobRepository;
import com.scholary.captions.service.CaptionJobRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for caption jobs.
 *
 * <ul>
 *   <li>Start an asynchronous caption job
 *   <li>Poll or cancel a job, or list the jobs still running
 *   <li>Preview chunk boundaries for a duration
 * </ul>
 */
@RestController
@Tag(name = "Captions", description = "Caption generation API")
public class CaptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionController.class);

  private final CaptionJobRunner jobRunner;
  private final JobRepository jobRepository;
  private final Chunker chunker;
  private final CaptionProperties properties;

  public CaptionController(
      CaptionJobRunner jobRunner,
      JobRepository jobRepository,
      Chunker chunker,
      CaptionProperties properties) {
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
    this.chunker = chunker;
    this.properties = properties;
  }

  @PostMapping("/api/captions")
  @Operation(
      summary = "Start caption job",
      description = "Start an asynchronous caption job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> caption(@Valid @RequestBody CaptionRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Caption request: bucket={}, key={}, format={}",
        request.bucket(),
        request.key(),
        request.format());

    CaptionJob job = new CaptionJob(jobId, request);
    jobRepository.save(job);
    jobRunner.runAsync(job);

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a caption job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/api/jobs")
  @Operation(summary = "List active jobs", description = "Jobs that are pending or processing")
  public List<JobStatusResponse> listActiveJobs() {
    return jobRepository.findActive().stream()
        .map(JobStatusResponse::from)
        .collect(Collectors.toList());
  }

  @DeleteMapping("/api/jobs/{id}")
  @Operation(
      summary = "Cancel job",
      description =
          "Stop issuing new calls for a job. Jobs that asked for partial results keep the"
              + " chunks finished so far")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job -> {
              LOGGER.info("Cancellation requested for job {}", id);
              job.requestCancellation();
              jobRepository.save(job);
              return ResponseEntity.accepted().body(JobStatusResponse.from(job));
            })
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/api/chunks/preview")
  @Operation(
      summary = "Preview chunks",
      description = "Show the chunk windows a job would use for a given duration")
  public ResponseEntity<ChunkPreviewResponse> previewChunks(
      @Valid @RequestBody ChunkPreviewRequest request) {
    double chunkSeconds =
        request.chunkSeconds() != null
            ? request.chunkSeconds()
            : properties.chunking().chunkSeconds();
    double overlapSeconds =
        request.overlapSeconds() != null
            ? request.overlapSeconds()
            : properties.chunking().overlapSeconds();
    List<Chunk> chunks = chunker.planChunks(request.durationSeconds(), chunkSeconds, overlapSeconds);

    List<ChunkPreviewResponse.ChunkPlan> plans =
        chunks.stream().map(ChunkPreviewResponse.ChunkPlan::of).collect(Collectors.toList());
    return ResponseEntity.ok(
        new ChunkPreviewResponse(request.durationSeconds(), plans.size(), plans));
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleConfigurationError(ConfigurationException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
  }
}
