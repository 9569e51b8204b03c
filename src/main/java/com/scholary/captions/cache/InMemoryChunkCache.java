package com.scholary.captions.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.captions.transcript.ChunkTranscript;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Caffeine-backed ChunkCache.
 *
 * <p>Entries expire after {@code captions.cache.ttlHours} and the cache holds at most {@code
 * captions.cache.maxSize} chunks.
 */
@Component
public class InMemoryChunkCache implements ChunkCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryChunkCache.class);

  private final Cache<String, ChunkTranscript> cache;

  public InMemoryChunkCache(
      @Value("${captions.cache.maxSize:1000}") int maxSize,
      @Value("${captions.cache.ttlHours:24}") int ttlHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(ttlHours))
            .recordStats()
            .build();

    LOGGER.info("Initialized chunk cache: maxSize={}, ttlHours={}", maxSize, ttlHours);
  }

  @Override
  public void put(String cacheKey, ChunkTranscript transcript) {
    if (transcript.failed()) {
      LOGGER.debug("Not caching failed chunk: key={}", cacheKey);
      return;
    }
    cache.put(cacheKey, transcript);
    LOGGER.debug("Cached chunk: key={}, segments={}", cacheKey, transcript.segments().size());
  }

  @Override
  public Optional<ChunkTranscript> get(String cacheKey) {
    ChunkTranscript transcript = cache.getIfPresent(cacheKey);
    LOGGER.debug("Chunk cache {}: key={}", transcript != null ? "hit" : "miss", cacheKey);
    return Optional.ofNullable(transcript);
  }

  @Override
  public void evictFile(String bucket, String key) {
    String prefix = ChunkCache.generateFilePrefix(bucket, key);
    List<String> keys =
        cache.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).collect(Collectors.toList());
    cache.invalidateAll(keys);
    LOGGER.info("Evicted {} chunks for file: bucket={}, key={}", keys.size(), bucket, key);
  }

  @Override
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "ChunkCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
