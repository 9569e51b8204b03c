package com.scholary.captions.service;

import com.scholary.captions.audit.AuditTrail;
import com.scholary.captions.job.CancellationToken;
import java.nio.file.Path;

/**
 * Input of one engine run.
 *
 * @param source local copy of the source media
 * @param bucket source bucket, used as chunk cache scope; null disables the cache
 * @param key source key, used as chunk cache scope; null disables the cache
 * @param totalDuration length of the audio track in seconds
 * @param chunkSeconds chunk size
 * @param overlapSeconds extra audio sent past each chunk's nominal end
 * @param allowPartial on cancellation, return the chunk results received so far instead of failing
 * @param refresh drop cached chunks of this source before transcribing
 * @param cancellation checked before every collaborator call
 * @param audit receives audio and raw replies
 */
public record AssemblyRequest(
    Path source,
    String bucket,
    String key,
    double totalDuration,
    double chunkSeconds,
    double overlapSeconds,
    boolean allowPartial,
    boolean refresh,
    CancellationToken cancellation,
    AuditTrail audit) {

  public AssemblyRequest {
    cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    audit = audit == null ? AuditTrail.NONE : audit;
  }

  boolean cacheable() {
    return bucket != null && key != null;
  }
}
