package com.scholary.captions.service;

import com.scholary.captions.api.CaptionRequest;
import com.scholary.captions.api.CaptionResponse;
import com.scholary.captions.audit.AuditRecorder;
import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.config.ConfigurationException;
import com.scholary.captions.job.CancellationToken;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.media.MediaExtractor;
import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.captions.render.CaptionExport;
import com.scholary.captions.render.CaptionFormat;
import com.scholary.captions.render.CaptionWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Captions one file from object storage.
 *
 * <p>Downloads the source to a temp file, measures it, runs the {@link CaptionAssemblyEngine},
 * renders the requested format and optionally saves the document and JSON export next to the
 * source.
 */
@Service
public class CaptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionService.class);

  private final ObjectStoreClient objectStoreClient;
  private final MediaExtractor mediaExtractor;
  private final CaptionAssemblyEngine engine;
  private final CaptionWriter captionWriter;
  private final AuditRecorder auditRecorder;
  private final CaptionProperties properties;
  private final Path tempDir;

  public CaptionService(
      ObjectStoreClient objectStoreClient,
      MediaExtractor mediaExtractor,
      CaptionAssemblyEngine engine,
      CaptionWriter captionWriter,
      AuditRecorder auditRecorder,
      CaptionProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.mediaExtractor = mediaExtractor;
    this.engine = engine;
    this.captionWriter = captionWriter;
    this.auditRecorder = auditRecorder;
    this.properties = properties;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /**
   * Caption a file.
   *
   * @param jobId job identifier, used for logs and audit keys
   * @param request the request
   * @param cancellation job cancellation flag
   * @param progress receives coarse progress
   * @return the rendered captions with diagnostics
   * @throws ConfigurationException if the request or the source duration is out of bounds
   * @throws com.scholary.captions.job.CaptionJobCancelledException if cancelled without partial
   *     results
   * @throws IOException if the source cannot be downloaded or the output cannot be written
   */
  public CaptionResponse caption(
      String jobId, CaptionRequest request, CancellationToken cancellation, ProgressListener progress)
      throws IOException {
    long startTime = System.currentTimeMillis();
    StructuredLogger.setJobContext(jobId, request.bucket(), request.key());
    Path source = null;

    try {
      CaptionFormat format = CaptionFormat.fromName(request.format());
      double chunkSeconds =
          request.chunkSeconds() != null
              ? request.chunkSeconds()
              : properties.chunking().chunkSeconds();
      double overlapSeconds =
          request.overlapSeconds() != null
              ? request.overlapSeconds()
              : properties.chunking().overlapSeconds();

      LOGGER.info(
          "Starting caption job: bucket={}, key={}, format={}, chunkSeconds={}, overlapSeconds={}",
          request.bucket(),
          request.key(),
          format,
          chunkSeconds,
          overlapSeconds);

      source = download(jobId, request.bucket(), request.key());
      double duration = mediaExtractor.probeDuration(source);
      validateDuration(duration);

      AssemblyResult result =
          engine.assemble(
              new AssemblyRequest(
                  source,
                  request.bucket(),
                  request.key(),
                  duration,
                  chunkSeconds,
                  overlapSeconds,
                  request.allowPartial(),
                  request.refresh(),
                  cancellation,
                  auditRecorder.forJob(jobId, request.bucket())),
              progress);

      String document = captionWriter.render(result.segments(), format);
      CaptionExport export =
          new CaptionExport(duration, result.partial(), result.segments(), result.usage());

      CaptionResponse.StorageInfo storage = null;
      if (request.save()) {
        storage =
            captionWriter.saveCaptions(
                request.bucket(), request.key(), document, format, export);
      }

      long elapsed = System.currentTimeMillis() - startTime;
      LOGGER.info(
          "Caption job finished: segments={}, partial={}, took={}ms",
          result.segments().size(),
          result.partial(),
          elapsed);

      return new CaptionResponse(
          jobId,
          format.extension(),
          document,
          result.segments(),
          result.usage(),
          new CaptionResponse.Diagnostics(
              duration,
              result.chunkCount(),
              result.failedChunks(),
              result.cachedChunks(),
              result.gaps().detected(),
              result.gaps().filled(),
              result.gaps().silenceFallbacks(),
              result.optimizationApplied(),
              result.optimizationNote(),
              elapsed),
          storage,
          result.partial());
    } finally {
      deleteQuietly(source);
      StructuredLogger.clearJobContext();
    }
  }

  private Path download(String jobId, String bucket, String key) throws IOException {
    ObjectMetadata metadata = objectStoreClient.getObjectMetadata(bucket, key);
    LOGGER.info("Downloading source: {} MB", metadata.contentLength() / 1024 / 1024);

    String extension = key.matches(".*\\.[A-Za-z0-9]{1,5}$") ? key.substring(key.lastIndexOf('.')) : "";
    Path target = tempDir.resolve("source_" + jobId + extension);
    try (InputStream in = objectStoreClient.getObjectStream(bucket, key)) {
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    }
    return target;
  }

  private void validateDuration(double durationSeconds) {
    double maxSeconds = properties.chunking().maxSourceDurationHours() * 3600.0;
    if (durationSeconds > maxSeconds) {
      throw new ConfigurationException(
          String.format(
              "Source is %.0f seconds long, the limit is %d hours",
              durationSeconds, properties.chunking().maxSourceDurationHours()));
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
    }
  }
}
