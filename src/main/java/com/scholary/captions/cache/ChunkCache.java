package com.scholary.captions.cache;

import com.scholary.captions.chunking.Chunk;
import com.scholary.captions.transcript.ChunkTranscript;
import java.util.Locale;
import java.util.Optional;

/**
 * Cache of successful chunk transcriptions.
 *
 * <p>A job resubmitted for the same source with the same chunking reuses the chunks it already
 * transcribed. Failed chunks are never stored, so a retry asks the service again.
 *
 * <p>Keys combine bucket, key, chunk index and chunk window.
 */
public interface ChunkCache {

  void put(String cacheKey, ChunkTranscript transcript);

  Optional<ChunkTranscript> get(String cacheKey);

  /** Drop every cached chunk of one source file. */
  void evictFile(String bucket, String key);

  /** One-line summary of size and hit rate, for logs. */
  String getStats();

  static String generateKey(String bucket, String key, Chunk chunk) {
    return String.format(
        Locale.ROOT,
        "%s:%s:chunk-%d:%.3f-%.3f",
        bucket,
        key,
        chunk.index(),
        chunk.start(),
        chunk.end());
  }

  static String generateFilePrefix(String bucket, String key) {
    return String.format("%s:%s:", bucket, key);
  }
}
