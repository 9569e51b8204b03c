package com.scholary.captions.audit;

import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.media.AudioClip;
import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates per-job audit trails that upload to the object store.
 *
 * <p>Records land under {@code <jobId>/audit/} in the audit bucket, or in the source bucket when no
 * audit bucket is configured. Upload failures are logged and otherwise ignored.
 */
@Component
public class AuditRecorder {

  private static final Logger LOGGER = LoggerFactory.getLogger(AuditRecorder.class);

  private final ObjectStoreClient objectStoreClient;
  private final CaptionProperties.AuditProperties properties;

  public AuditRecorder(ObjectStoreClient objectStoreClient, CaptionProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties.audit();
  }

  /**
   * Audit trail for one job.
   *
   * @param jobId the job
   * @param sourceBucket bucket of the source file, used when no audit bucket is configured
   * @return an uploading trail, or {@link AuditTrail#NONE} when auditing is off
   */
  public AuditTrail forJob(String jobId, String sourceBucket) {
    if (!properties.enabled()) {
      return AuditTrail.NONE;
    }
    String bucket =
        properties.bucket() != null && !properties.bucket().isBlank()
            ? properties.bucket()
            : sourceBucket;
    return new ObjectStoreAuditTrail(bucket, jobId + "/audit/");
  }

  private class ObjectStoreAuditTrail implements AuditTrail {

    private final String bucket;
    private final String prefix;

    ObjectStoreAuditTrail(String bucket, String prefix) {
      this.bucket = bucket;
      this.prefix = prefix;
    }

    @Override
    public void recordAudio(String name, AudioClip clip) {
      upload(name, clip.data(), clip.mimeType());
    }

    @Override
    public void recordReply(String name, String reply) {
      upload(name, reply.getBytes(StandardCharsets.UTF_8), "text/plain; charset=utf-8");
    }

    private void upload(String name, byte[] data, String contentType) {
      try {
        objectStoreClient.putBytes(bucket, prefix + name, data, contentType);
      } catch (ObjectStoreException e) {
        LOGGER.warn("Could not write audit record {}{}: {}", prefix, name, e.getMessage());
      }
    }
  }
}
